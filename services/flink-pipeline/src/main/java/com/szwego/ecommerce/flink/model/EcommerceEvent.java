package com.szwego.ecommerce.flink.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 电商事件: 一次用户对商品的操作 (view / cart / order / purchase ...)
 *
 * <p>event_id 是幂等键, 目标表主键 (ON CONFLICT (event_id) DO NOTHING)
 * <p>priceCategory / deviceType 由 EventEnricher 派生, 解析阶段为 null
 * <p>sourceFields: 原始行中实际出现的列名, 供 BatchValidator 做列缺失检测
 */
public class EcommerceEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    /** 原始数据列 (CSV 列顺序 / JSON 字段名), 不含派生列 */
    public static final List<String> SOURCE_COLUMNS = Collections.unmodifiableList(Arrays.asList(
        "event_id", "event_type", "product_id", "product_name",
        "category", "brand", "sku", "price", "customer_id",
        "customer_email", "customer_name", "customer_address",
        "session_id", "user_agent", "ip_address", "event_timestamp"
    ));

    private String eventId;
    private String eventType;        // view | order | cart | click | purchase | add_to_wishlist
    private Integer productId;
    private String productName;
    private String category;
    private String brand;
    private String sku;
    private BigDecimal price;
    private String customerId;
    private String customerEmail;
    private String customerName;
    private String customerAddress;
    private String sessionId;
    private String userAgent;
    private String ipAddress;
    private Instant eventTimestamp;

    private PriceCategory priceCategory;
    private DeviceType deviceType;

    private Set<String> sourceFields = new LinkedHashSet<>(SOURCE_COLUMNS);

    public EcommerceEvent() {}

    public EcommerceEvent(String eventId, String eventType, Integer productId, BigDecimal price,
                          Instant eventTimestamp) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.productId = productId;
        this.price = price;
        this.eventTimestamp = eventTimestamp;
    }

    public EcommerceEvent copy() {
        EcommerceEvent c = new EcommerceEvent();
        c.eventId = eventId;
        c.eventType = eventType;
        c.productId = productId;
        c.productName = productName;
        c.category = category;
        c.brand = brand;
        c.sku = sku;
        c.price = price;
        c.customerId = customerId;
        c.customerEmail = customerEmail;
        c.customerName = customerName;
        c.customerAddress = customerAddress;
        c.sessionId = sessionId;
        c.userAgent = userAgent;
        c.ipAddress = ipAddress;
        c.eventTimestamp = eventTimestamp;
        c.priceCategory = priceCategory;
        c.deviceType = deviceType;
        c.sourceFields = new LinkedHashSet<>(sourceFields);
        return c;
    }

    // Getters & Setters
    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }
    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }
    public Integer getProductId() { return productId; }
    public void setProductId(Integer productId) { this.productId = productId; }
    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getBrand() { return brand; }
    public void setBrand(String brand) { this.brand = brand; }
    public String getSku() { return sku; }
    public void setSku(String sku) { this.sku = sku; }
    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }
    public String getCustomerId() { return customerId; }
    public void setCustomerId(String customerId) { this.customerId = customerId; }
    public String getCustomerEmail() { return customerEmail; }
    public void setCustomerEmail(String customerEmail) { this.customerEmail = customerEmail; }
    public String getCustomerName() { return customerName; }
    public void setCustomerName(String customerName) { this.customerName = customerName; }
    public String getCustomerAddress() { return customerAddress; }
    public void setCustomerAddress(String customerAddress) { this.customerAddress = customerAddress; }
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    public String getIpAddress() { return ipAddress; }
    public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }
    public Instant getEventTimestamp() { return eventTimestamp; }
    public void setEventTimestamp(Instant eventTimestamp) { this.eventTimestamp = eventTimestamp; }
    public PriceCategory getPriceCategory() { return priceCategory; }
    public void setPriceCategory(PriceCategory priceCategory) { this.priceCategory = priceCategory; }
    public DeviceType getDeviceType() { return deviceType; }
    public void setDeviceType(DeviceType deviceType) { this.deviceType = deviceType; }
    public Set<String> getSourceFields() { return sourceFields; }
    public void setSourceFields(Set<String> sourceFields) { this.sourceFields = sourceFields; }

    @Override
    public String toString() {
        return "EcommerceEvent{eventId=" + eventId + ", eventType=" + eventType
            + ", productId=" + productId + ", price=" + price
            + ", category=" + category + ", deviceType=" + deviceType
            + ", priceCategory=" + priceCategory + "}";
    }
}
