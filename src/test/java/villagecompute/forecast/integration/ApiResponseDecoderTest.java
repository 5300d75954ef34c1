/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.http.HttpResponse;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.forecast.WireMockTestBase;
import villagecompute.forecast.api.types.AlertType;
import villagecompute.forecast.api.types.ApiResponseType;
import villagecompute.forecast.api.types.DataPointType;
import villagecompute.forecast.api.types.Icon;
import villagecompute.forecast.api.types.PrecipType;
import villagecompute.forecast.api.types.Severity;
import villagecompute.forecast.api.types.Units;
import villagecompute.forecast.exceptions.ForecastApiException;

/**
 * Unit tests for {@link ApiResponseDecoder}.
 */
class ApiResponseDecoderTest {

    private ApiResponseDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new ApiResponseDecoder(new ObjectMapper());
    }

    @Test
    void testDecode_forecastFixture() {
        ApiResponseType response = decoder.decode(fixture("forecast-success.json"));

        assertEquals(6.66, response.latitude());
        assertEquals(66.6, response.longitude());
        assertEquals("Indian/Maldives", response.timezone());
        assertEquals(5.0, response.offset());

        DataPointType currently = response.currently();
        assertNotNull(currently);
        assertEquals(1736420400L, currently.time());
        assertEquals(Icon.PARTLY_CLOUDY_DAY, currently.icon());
        assertEquals(PrecipType.RAIN, currently.precipType());
        assertEquals(82.4, currently.temperature());
        assertEquals(64.0, currently.windBearing());
        assertNull(currently.sunriseTime());

        assertNull(response.minutely(), "Absent block should decode as null");
        assertEquals(2, response.hourly().data().size());
        assertEquals(Icon.CLOUDY, response.hourly().data().get(1).icon());
        assertEquals("Light rain on Thursday.", response.daily().summary());
        assertEquals(Icon.RAIN, response.daily().icon());
        assertEquals(1736386021L, response.daily().data().get(0).sunriseTime());
    }

    @Test
    void testDecode_alertsAndFlags() {
        ApiResponseType response = decoder.decode(fixture("forecast-success.json"));

        assertEquals(1, response.alerts().size());
        AlertType alert = response.alerts().get(0);
        assertEquals("Small Craft Advisory", alert.title());
        assertEquals(Severity.ADVISORY, alert.severity());
        assertEquals(List.of("North Male Atoll", "South Male Atoll"), alert.regions());
        assertEquals(1736460000L, alert.expires());

        assertEquals(Units.UK, response.flags().units());
        assertEquals(List.of("ETOPO1", "gfs", "gefs"), response.flags().sources());
        assertNull(response.flags().darkskyUnavailable());
    }

    @Test
    void testDecode_historicalFixture() {
        ApiResponseType response = decoder.decode(fixture("historical-success.json"));

        assertEquals(666L, response.currently().time());
        assertEquals(Icon.CLEAR_NIGHT, response.currently().icon());
        assertEquals(Units.IMPERIAL, response.flags().units());
        assertNull(response.hourly());
        assertNull(response.daily());
        assertNull(response.alerts());
    }

    @Test
    void testDecode_successfulHttpResponse() {
        HttpResponse<String> http = httpResponse(200, fixture("historical-success.json"));

        ApiResponseType response = decoder.decode(http);

        assertEquals("Indian/Maldives", response.timezone());
    }

    @Test
    void testDecode_errorStatusRaisesWithStatusCode() {
        HttpResponse<String> http = httpResponse(403, fixture("unauthorized.json"));

        ForecastApiException e = assertThrows(ForecastApiException.class, () -> decoder.decode(http));

        assertEquals(403, e.getStatusCode());
        assertTrue(e.getMessage().contains("Forbidden"));
    }

    @Test
    void testDecode_invalidJson() {
        ForecastApiException e = assertThrows(ForecastApiException.class, () -> decoder.decode("{not json"));

        assertInstanceOf(JsonProcessingException.class, e.getCause());
    }

    @Test
    void testDecode_unknownEnumTokenRejected() {
        String json = "{\"latitude\":1.0,\"longitude\":2.0,\"flags\":{\"units\":\"metric\"}}";

        assertThrows(ForecastApiException.class, () -> decoder.decode(json));
    }

    @Test
    void testDecode_unknownFieldsIgnored() {
        String json = "{\"latitude\":1.0,\"longitude\":2.0,\"elevation\":12,\"currently\":{\"time\":5,\"foo\":true}}";

        ApiResponseType response = decoder.decode(json);

        assertEquals(5L, response.currently().time());
    }

    @Test
    void testDecode_blankBody() {
        assertThrows(ForecastApiException.class, () -> decoder.decode(""));
        assertThrows(ForecastApiException.class, () -> decoder.decode(httpResponse(200, "  ")));
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> httpResponse(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    private static String fixture(String name) {
        return WireMockTestBase.loadStubFile("wiremock/pirate-weather/" + name);
    }
}
