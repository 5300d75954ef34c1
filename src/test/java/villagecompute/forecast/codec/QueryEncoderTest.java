/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import villagecompute.forecast.api.types.ExcludeBlock;
import villagecompute.forecast.api.types.ExtendBy;
import villagecompute.forecast.api.types.Lang;
import villagecompute.forecast.api.types.Units;

/**
 * Unit tests for {@link QueryEncoder}.
 */
class QueryEncoderTest {

    @Test
    void testEncode_keepsCallerOrder() {
        String query = new QueryEncoder().param("units", Units.SI).param("lang", Lang.GERMAN).encode();

        assertEquals("units=si&lang=de", query);
    }

    @Test
    void testEncode_skipsAbsentValues() {
        String query = new QueryEncoder().params("exclude", List.of()).param("extend", (ExtendBy) null)
                .param("lang", Lang.ENGLISH).param("units", (Units) null).param("note", "").encode();

        assertEquals("lang=en", query);
    }

    @Test
    void testEncode_emptyEncoderProducesEmptyString() {
        QueryEncoder encoder = new QueryEncoder().params("exclude", List.of()).param("lang", (Lang) null);

        assertTrue(encoder.isEmpty());
        assertEquals("", encoder.encode());
        assertEquals("https://example.com/x", encoder.appendTo("https://example.com/x"));
    }

    @Test
    void testParams_commaJoinedAndLiteral() {
        String query = new QueryEncoder()
                .params("exclude", List.of(ExcludeBlock.HOURLY, ExcludeBlock.DAILY, ExcludeBlock.ALERTS)).encode();

        assertEquals("exclude=hourly,daily,alerts", query);
    }

    @Test
    void testParams_duplicatesPreserved() {
        String query = new QueryEncoder()
                .params("exclude", List.of(ExcludeBlock.FLAGS, ExcludeBlock.FLAGS, ExcludeBlock.CURRENTLY)).encode();

        assertEquals("exclude=flags,flags,currently", query);
    }

    @Test
    void testParam_rawValuesArePercentEncoded() {
        String query = new QueryEncoder().param("q", "a b&c=d/é").encode();

        assertEquals("q=a+b%26c%3Dd%2F%C3%A9", query);
    }

    @Test
    void testParam_hyphenatedTokensUntouched() {
        String query = new QueryEncoder().param("lang", Lang.IGPAY_ATINLAY).encode();

        assertEquals("lang=x-pig-latin", query);
    }

    @Test
    void testAppendTo_addsQuestionMarkOnlyWhenNeeded() {
        String url = new QueryEncoder().param("units", Units.IMPERIAL).appendTo("https://example.com/x");

        assertEquals("https://example.com/x?units=us", url);
    }
}
