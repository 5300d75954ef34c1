/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Weather conditions at a point in time, or averaged over an hour or day depending on the enclosing block.
 *
 * <p>
 * Every field except {@code time} is optional on the wire and is {@code null} when absent. Times are UNIX epoch
 * seconds. Deprecated Dark Sky fields ({@code temperatureMax}, {@code apparentTemperatureMin}, ...) are ignored.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record DataPointType(long time, String summary, Icon icon, Double apparentTemperature,
        Double apparentTemperatureHigh, Long apparentTemperatureHighTime, Double apparentTemperatureLow,
        Long apparentTemperatureLowTime, Double cloudCover, Double dewPoint, Double humidity, Double moonPhase,
        Double nearestStormBearing, Double nearestStormDistance, Double ozone, Double precipAccumulation,
        Double precipIntensity, Double precipIntensityMax, Long precipIntensityMaxTime, Double precipProbability,
        PrecipType precipType, Double pressure, Long sunriseTime, Long sunsetTime, Double temperature,
        Double temperatureHigh, Long temperatureHighTime, Double temperatureLow, Long temperatureLowTime,
        Double uvIndex, Long uvIndexTime, Double visibility, Double windBearing, Double windGust, Long windGustTime,
        Double windSpeed) {
}
