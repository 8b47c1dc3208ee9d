package com.szwego.ecommerce.flink.model;

import java.math.BigDecimal;

/**
 * 价格分档: 阈值 0 / 50 / 200
 */
public enum PriceCategory {
    UNKNOWN("Unknown"),
    INVALID("Invalid"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private static final BigDecimal LOW_UPPER = BigDecimal.valueOf(50);
    private static final BigDecimal MEDIUM_UPPER = BigDecimal.valueOf(200);

    private final String label;

    PriceCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static PriceCategory of(BigDecimal price) {
        if (price == null) return UNKNOWN;
        if (price.signum() < 0) return INVALID;
        if (price.compareTo(LOW_UPPER) < 0) return LOW;
        if (price.compareTo(MEDIUM_UPPER) < 0) return MEDIUM;
        return HIGH;
    }
}
