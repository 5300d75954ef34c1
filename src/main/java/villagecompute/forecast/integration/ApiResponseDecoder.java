/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.integration;

import java.net.http.HttpResponse;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.forecast.api.types.ApiResponseType;
import villagecompute.forecast.exceptions.ForecastApiException;

/**
 * Decodes Pirate Weather response bodies into {@link ApiResponseType}.
 *
 * <p>
 * Decoding is structural only: unknown fields are ignored, absent blocks become {@code null}, and enum-valued fields
 * go through the same wire tables used to build requests.
 */
public class ApiResponseDecoder {

    private static final Logger LOG = Logger.getLogger(ApiResponseDecoder.class);

    private final ObjectMapper objectMapper;

    public ApiResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes a successful HTTP response.
     *
     * @param response
     *            response returned by {@link HttpClientTransport}
     * @return decoded body
     * @throws ForecastApiException
     *             if the status is not 2xx or the body is not a valid response document
     */
    public ApiResponseType decode(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ForecastApiException("Pirate Weather API returned status " + status + ": " + response.body(),
                    status);
        }
        return decode(response.body(), status);
    }

    /**
     * Decodes a raw JSON body.
     *
     * @param json
     *            response body
     * @return decoded body
     * @throws ForecastApiException
     *             if the body is not a valid response document
     */
    public ApiResponseType decode(String json) {
        return decode(json, 200);
    }

    private ApiResponseType decode(String json, int status) {
        if (json == null || json.isBlank()) {
            throw new ForecastApiException("Pirate Weather API returned an empty body", status);
        }
        try {
            return objectMapper.readValue(json, ApiResponseType.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Failed to decode Pirate Weather response: %s", e.getOriginalMessage());
            throw new ForecastApiException("Failed to decode Pirate Weather response", status, e);
        }
    }
}
