/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of a forecast or historical response.
 *
 * <p>
 * Blocks listed in the request's {@code exclude} parameter are absent and decode as {@code null}.
 *
 * @param latitude
 *            requested latitude
 * @param longitude
 *            requested longitude
 * @param timezone
 *            IANA timezone name for the location (e.g., "America/New_York")
 * @param offset
 *            current UTC offset in hours; deprecated upstream in favour of {@code timezone}
 * @param currently
 *            current conditions
 * @param minutely
 *            minute-by-minute block for the next hour
 * @param hourly
 *            hour-by-hour block
 * @param daily
 *            day-by-day block
 * @param alerts
 *            active severe weather alerts
 * @param flags
 *            request metadata
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record ApiResponseType(double latitude, double longitude, String timezone, Double offset,
        DataPointType currently, DataBlockType minutely, DataBlockType hourly, DataBlockType daily,
        List<AlertType> alerts, FlagsType flags) {

    public ApiResponseType {
        alerts = alerts == null ? null : List.copyOf(alerts);
    }
}
