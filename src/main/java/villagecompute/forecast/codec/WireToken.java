/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.codec;

/**
 * An enum variant with a canonical string form on the Pirate Weather wire.
 *
 * <p>
 * The returned token is the bare value (e.g. {@code ar}, {@code uk2}), never quoted or escaped.
 */
public interface WireToken {

    String token();
}
