package com.szwego.ecommerce.flink.function;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.szwego.ecommerce.flink.model.EcommerceEvent;
import com.szwego.ecommerce.flink.util.EventFieldParser;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeHint;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kafka 电商事件 JSON 反序列化
 *
 * <p>按树解析而不是直接绑定 POJO: 需要知道哪些字段实际出现 (列缺失检测), 且数值 / 时间宽松解析
 * <p>JSON null 视为字段出现但值为空; 未知字段忽略
 */
public class EcommerceEventDeserializer implements DeserializationSchema<EcommerceEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(EcommerceEventDeserializer.class);
    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;
    private transient long failedCount = 0;

    private ObjectMapper getMapper() {
        if (mapper == null) {
            // 价格按 BigDecimal 读, 避免 double 精度损失
            mapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        }
        return mapper;
    }

    @Override
    public EcommerceEvent deserialize(byte[] message) throws IOException {
        try {
            JsonNode root = getMapper().readTree(message);
            if (root == null || !root.isObject()) {
                throw new IOException("expected a JSON object, got " + (root == null ? "nothing" : root.getNodeType()));
            }
            Map<String, String> fields = new LinkedHashMap<>();
            for (String column : EcommerceEvent.SOURCE_COLUMNS) {
                JsonNode value = root.get(column);
                if (value != null) {
                    fields.put(column, value.isNull() ? null : value.asText());
                }
            }
            return EventFieldParser.fromFields(fields);
        } catch (Exception e) {
            failedCount++;
            String preview = new String(message, 0, Math.min(message.length, 500), StandardCharsets.UTF_8);
            LOG.error("Failed to deserialize ecommerce event (total_failed={}): [{}] error: {}",
                    failedCount, preview, e.getMessage());
            return null;  // 下游 .filter(Objects::nonNull) 过滤
        }
    }

    @Override
    public boolean isEndOfStream(EcommerceEvent event) {
        return false;
    }

    @Override
    public TypeInformation<EcommerceEvent> getProducedType() {
        return TypeInformation.of(new TypeHint<EcommerceEvent>() {});
    }
}
