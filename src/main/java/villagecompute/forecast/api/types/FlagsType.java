/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Miscellaneous metadata about a request.
 *
 * @param darkskyUnavailable
 *            present when data for the location is temporarily unavailable
 * @param sources
 *            identifiers of the data sources used
 * @param units
 *            units the response data is expressed in
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FlagsType(@JsonProperty("darksky-unavailable") String darkskyUnavailable, List<String> sources,
        Units units) {

    public FlagsType {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
