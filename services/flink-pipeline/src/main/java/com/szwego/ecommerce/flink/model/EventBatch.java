package com.szwego.ecommerce.flink.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 微批: 上游引擎一次投递的有序事件集合
 *
 * <p>batchId 由引擎分配 (单调, 不保证连续), 故障恢复后重投时可能重复
 * <p>整批是校验/去重/重试的最小单位, 不会部分重放
 */
public class EventBatch implements Serializable {
    private static final long serialVersionUID = 1L;

    private final long batchId;
    private final List<EcommerceEvent> events;

    public EventBatch(long batchId, List<EcommerceEvent> events) {
        if (batchId < 0) {
            throw new IllegalArgumentException("batchId must be >= 0, got " + batchId);
        }
        this.batchId = batchId;
        this.events = new ArrayList<>(events);
    }

    public long getBatchId() { return batchId; }
    public List<EcommerceEvent> getEvents() { return Collections.unmodifiableList(events); }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
