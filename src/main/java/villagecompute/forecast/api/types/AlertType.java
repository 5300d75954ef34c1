/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Severe weather warning issued by a government authority for the requested location.
 *
 * @param description
 *            detailed alert text
 * @param expires
 *            UNIX time at which the alert expires
 * @param regions
 *            affected region names
 * @param severity
 *            alert severity
 * @param time
 *            UNIX time at which the alert was issued
 * @param title
 *            short alert title
 * @param uri
 *            link to the issuing authority's details page
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record AlertType(String description, long expires, List<String> regions, Severity severity, long time,
        String title, String uri) {

    public AlertType {
        regions = regions == null ? List.of() : List.copyOf(regions);
    }
}
