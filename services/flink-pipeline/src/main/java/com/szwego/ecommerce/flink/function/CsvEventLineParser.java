package com.szwego.ecommerce.flink.function;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.szwego.ecommerce.flink.model.EcommerceEvent;
import com.szwego.ecommerce.flink.util.EventFieldParser;
import org.apache.flink.api.common.functions.FlatMapFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV 文本行 → EcommerceEvent
 *
 * <p>列顺序固定为 {@link EcommerceEvent#SOURCE_COLUMNS}; 表头行 (首列为 event_id) 跳过
 * <p>列数不足的行: 缺少的尾部列视为缺失, 交给 BatchValidator 判定
 * <p>无法解析的行记日志后丢弃, 不中断作业
 */
public class CsvEventLineParser implements FlatMapFunction<String, EcommerceEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CsvEventLineParser.class);
    private static final String HEADER_FIRST_COLUMN = EcommerceEvent.SOURCE_COLUMNS.get(0);

    private transient CsvMapper mapper;
    private transient long failedCount = 0;

    private CsvMapper getMapper() {
        if (mapper == null) {
            mapper = new CsvMapper();
            mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        }
        return mapper;
    }

    @Override
    public void flatMap(String line, Collector<EcommerceEvent> out) {
        EcommerceEvent event = parse(line);
        if (event != null) {
            out.collect(event);
        }
    }

    /** @return null 表示空行 / 表头 / 无法解析 */
    public EcommerceEvent parse(String line) {
        if (line == null || line.isBlank()) return null;
        String[] cells;
        try (MappingIterator<String[]> it = getMapper().readerFor(String[].class).readValues(line)) {
            if (!it.hasNext()) return null;
            cells = it.next();
        } catch (Exception e) {
            failedCount++;
            String preview = line.substring(0, Math.min(line.length(), 500));
            LOG.error("Failed to parse CSV line (total_failed={}): [{}] error: {}",
                    failedCount, preview, e.getMessage());
            return null;
        }
        if (cells.length > 0 && HEADER_FIRST_COLUMN.equals(cells[0].trim())) {
            return null;
        }

        List<String> columns = EcommerceEvent.SOURCE_COLUMNS;
        if (cells.length > columns.size()) {
            LOG.warn("CSV line has {} cells, expected {}; extra cells ignored", cells.length, columns.size());
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < Math.min(cells.length, columns.size()); i++) {
            fields.put(columns.get(i), cells[i]);
        }
        return EventFieldParser.fromFields(fields);
    }
}
