package com.szwego.ecommerce.flink.dedup;

import com.szwego.ecommerce.flink.model.EcommerceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 批内去重: 每个 event_id 保留到达顺序中的第一条
 *
 * <p>只是减少写入量; 真正的幂等由 PG ON CONFLICT (event_id) DO NOTHING 保证
 */
public class BatchDeduplicator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchDeduplicator.class);

    public List<EcommerceEvent> deduplicate(List<EcommerceEvent> events) {
        Set<String> seen = new HashSet<>(events.size() * 2);
        List<EcommerceEvent> unique = new ArrayList<>(events.size());
        for (EcommerceEvent e : events) {
            if (seen.add(e.getEventId())) {
                unique.add(e);
            }
        }
        int removed = events.size() - unique.size();
        if (removed > 0) {
            LOG.info("Removed {} duplicate event_ids ({} → {})", removed, events.size(), unique.size());
        }
        return unique;
    }
}
