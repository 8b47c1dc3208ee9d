package com.szwego.ecommerce.flink.function;

import com.szwego.ecommerce.flink.model.EcommerceEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EcommerceEventDeserializerTest {

    private EcommerceEventDeserializer deserializer;

    @BeforeEach
    void setUp() {
        deserializer = new EcommerceEventDeserializer();
    }

    private EcommerceEvent parse(String json) throws IOException {
        return deserializer.deserialize(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void validJson() throws IOException {
        EcommerceEvent event = parse("""
            {"event_id": "9b2f", "event_type": "purchase", "product_id": 42,
             "product_name": "Desk Lamp", "category": "Home", "brand": "Lumo", "sku": "SKU-42",
             "price": 59.90, "customer_id": "c-7", "customer_email": "bob@example.com",
             "customer_name": "Bob", "customer_address": "2 Side St", "session_id": "s-9",
             "user_agent": "Mozilla/5.0", "ip_address": "192.168.0.4",
             "event_timestamp": "2024-03-01T10:15:30Z"}
            """);

        assertNotNull(event);
        assertEquals("9b2f", event.getEventId());
        assertEquals(42, event.getProductId());
        assertEquals(0, new BigDecimal("59.90").compareTo(event.getPrice()));
        assertEquals(Instant.parse("2024-03-01T10:15:30Z"), event.getEventTimestamp());
        assertEquals(EcommerceEvent.SOURCE_COLUMNS.size(), event.getSourceFields().size());
    }

    @Test
    void absentFieldsNotRecordedAsPresent() throws IOException {
        EcommerceEvent event = parse("{\"event_id\": \"e1\", \"brand\": null}");

        assertNotNull(event);
        assertTrue(event.getSourceFields().contains("event_id"));
        assertTrue(event.getSourceFields().contains("brand"));
        assertFalse(event.getSourceFields().contains("price"));
        assertNull(event.getBrand());
    }

    @Test
    void unparseableValuesBecomeNull() throws IOException {
        EcommerceEvent event = parse(
            "{\"event_id\": \"e1\", \"product_id\": \"abc\", \"price\": \"n/a\", \"event_timestamp\": \"yesterday\"}");

        assertNotNull(event);
        assertNull(event.getProductId());
        assertNull(event.getPrice());
        assertNull(event.getEventTimestamp());
    }

    @Test
    void unknownFieldsIgnored() throws IOException {
        EcommerceEvent event = parse("{\"event_id\": \"e1\", \"extra\": {\"nested\": true}}");
        assertNotNull(event);
        assertEquals("e1", event.getEventId());
    }

    @Test
    void invalidReturnsNull() throws IOException {
        assertNull(parse("not json at all"));
        assertNull(parse("[1, 2, 3]"));
    }

    @Test
    void producedType() {
        assertEquals(EcommerceEvent.class, deserializer.getProducedType().getTypeClass());
        assertFalse(deserializer.isEndOfStream(new EcommerceEvent()));
    }
}
