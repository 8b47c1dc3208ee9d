package com.szwego.ecommerce.flink.transform;

import com.szwego.ecommerce.flink.model.DeviceType;
import com.szwego.ecommerce.flink.model.EcommerceEvent;
import com.szwego.ecommerce.flink.model.PriceCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 派生字段 + 文本清洗 (纯函数, 无 I/O, 不抛异常)
 *
 * <p>trim: category / brand / product_name / sku / customer_name
 * <p>trim + lower: customer_email / event_type
 * <p>派生: price_category, device_type; 脏数据只打 Unknown/Invalid 标记, 交给 BatchValidator 处理
 */
public class EventEnricher {

    public List<EcommerceEvent> enrich(List<EcommerceEvent> events) {
        List<EcommerceEvent> out = new ArrayList<>(events.size());
        for (EcommerceEvent event : events) {
            out.add(enrich(event));
        }
        return out;
    }

    public EcommerceEvent enrich(EcommerceEvent source) {
        EcommerceEvent e = source.copy();
        e.setCategory(trim(e.getCategory()));
        e.setBrand(trim(e.getBrand()));
        e.setProductName(trim(e.getProductName()));
        e.setSku(trim(e.getSku()));
        e.setCustomerName(trim(e.getCustomerName()));
        e.setCustomerEmail(lowerTrim(e.getCustomerEmail()));
        e.setEventType(lowerTrim(e.getEventType()));

        e.setPriceCategory(PriceCategory.of(e.getPrice()));
        e.setDeviceType(DeviceType.of(e.getUserAgent()));
        return e;
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }

    private static String lowerTrim(String s) {
        return s == null ? null : s.trim().toLowerCase(Locale.ROOT);
    }
}
