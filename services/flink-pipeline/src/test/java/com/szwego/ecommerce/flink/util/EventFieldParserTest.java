package com.szwego.ecommerce.flink.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EventFieldParserTest {

    @Test
    void timestampFormats() {
        Instant expected = Instant.parse("2024-03-01T10:15:30Z");
        assertEquals(expected, EventFieldParser.parseTimestamp("2024-03-01T10:15:30Z"));
        assertEquals(expected, EventFieldParser.parseTimestamp("2024-03-01T12:15:30+02:00"));
        assertEquals(expected, EventFieldParser.parseTimestamp("2024-03-01T10:15:30"));
        assertEquals(expected, EventFieldParser.parseTimestamp("2024-03-01 10:15:30"));
        assertEquals(Instant.parse("2024-03-01T10:15:30.123456Z"),
                EventFieldParser.parseTimestamp("2024-03-01T10:15:30.123456"));
        assertNull(EventFieldParser.parseTimestamp("01/03/2024"));
        assertNull(EventFieldParser.parseTimestamp(" "));
    }

    @Test
    void numbers() {
        assertEquals(7, EventFieldParser.parseInteger(" 7 "));
        assertNull(EventFieldParser.parseInteger("7.5"));
        assertEquals(new BigDecimal("12.30"), EventFieldParser.parseDecimal("12.30"));
        assertNull(EventFieldParser.parseDecimal("12,30"));
    }
}
