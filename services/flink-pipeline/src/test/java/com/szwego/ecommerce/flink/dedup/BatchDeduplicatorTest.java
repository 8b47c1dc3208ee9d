package com.szwego.ecommerce.flink.dedup;

import com.szwego.ecommerce.flink.TestEvents;
import com.szwego.ecommerce.flink.model.EcommerceEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class BatchDeduplicatorTest {

    private final BatchDeduplicator deduplicator = new BatchDeduplicator();

    @Test
    void firstOccurrenceWins() {
        EcommerceEvent first = TestEvents.valid("e1", "10.00");
        EcommerceEvent second = TestEvents.valid("e1", "20.00");

        List<EcommerceEvent> out = deduplicator.deduplicate(List.of(first, TestEvents.valid("e2"), second));

        assertEquals(2, out.size());
        assertSame(first, out.get(0));
        assertEquals("e2", out.get(1).getEventId());
    }

    @Test
    void noDuplicatesUnchanged() {
        List<EcommerceEvent> in = List.of(TestEvents.valid("a"), TestEvents.valid("b"));
        assertEquals(in, deduplicator.deduplicate(in));
    }

    @Test
    void emptyInput() {
        assertTrue(deduplicator.deduplicate(List.of()).isEmpty());
    }
}
