/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Weather conditions over a period of time (the {@code minutely}, {@code hourly} and {@code daily} blocks).
 *
 * @param data
 *            data points ordered by time
 * @param summary
 *            human-readable summary of the period, if provided
 * @param icon
 *            icon for the period, if provided
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record DataBlockType(List<DataPointType> data, String summary, Icon icon) {

    public DataBlockType {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
