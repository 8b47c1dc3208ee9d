package com.szwego.ecommerce.flink.model;

import java.util.Arrays;
import java.util.Optional;

public enum EventType {
    VIEW("view"),
    ORDER("order"),
    CART("cart"),
    CLICK("click"),
    PURCHASE("purchase"),
    ADD_TO_WISHLIST("add_to_wishlist");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** 已归一化 (小写 + trim) 的取值 */
    public static Optional<EventType> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
            .filter(t -> t.value.equals(value))
            .findFirst();
    }
}
