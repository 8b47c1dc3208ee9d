package com.szwego.ecommerce.flink.function;

import com.szwego.ecommerce.flink.model.EcommerceEvent;
import com.szwego.ecommerce.flink.model.EventBatch;
import org.apache.flink.streaming.api.functions.windowing.ProcessAllWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;

import java.util.ArrayList;
import java.util.List;

/**
 * 窗口内全部事件 → 一个 EventBatch
 *
 * <p>batch_id = 窗口结束时间 (epoch ms): 单调递增, 可直接作为 staging 表后缀
 * <p>只有从 checkpoint 恢复的窗口状态保持原 batch_id; 恢复后重放的事件落入新的处理时间窗口, 拿到新 id
 */
public class MicroBatchWindowFunction
        extends ProcessAllWindowFunction<EcommerceEvent, EventBatch, TimeWindow> {

    private static final long serialVersionUID = 1L;

    @Override
    public void process(Context context, Iterable<EcommerceEvent> elements, Collector<EventBatch> out) {
        List<EcommerceEvent> events = new ArrayList<>();
        for (EcommerceEvent event : elements) {
            events.add(event);
        }
        out.collect(new EventBatch(context.window().getEnd(), events));
    }
}
