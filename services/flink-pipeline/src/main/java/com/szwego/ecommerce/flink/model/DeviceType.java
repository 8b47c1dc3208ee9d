package com.szwego.ecommerce.flink.model;

/**
 * 设备类型: 按 User-Agent 子串推断
 *
 * <p>匹配顺序固定: Mobile → Tablet → iPad → Android → iPhone, 都不命中为 Desktop
 */
public enum DeviceType {
    UNKNOWN("Unknown"),
    MOBILE("Mobile"),
    TABLET("Tablet"),
    DESKTOP("Desktop");

    private final String label;

    DeviceType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static DeviceType of(String userAgent) {
        if (userAgent == null) return UNKNOWN;
        if (userAgent.contains("Mobile")) return MOBILE;
        if (userAgent.contains("Tablet")) return TABLET;
        if (userAgent.contains("iPad")) return TABLET;
        if (userAgent.contains("Android")) return MOBILE;
        if (userAgent.contains("iPhone")) return MOBILE;
        return DESKTOP;
    }
}
