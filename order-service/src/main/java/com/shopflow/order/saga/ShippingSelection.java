package com.shopflow.order.saga;

import com.shopflow.order.entity.ShippingAddress;

import java.util.Map;

/**
 * 배송 선택 - 기본 모드(standard|express), 상품별 모드, 배송지
 */
public record ShippingSelection(String defaultMode, Map<String, String> itemModes, ShippingAddress address) {

    public ShippingSelection {
        itemModes = itemModes == null ? Map.of() : Map.copyOf(itemModes);
    }

    public String modeFor(String productId, String fallback) {
        String mode = itemModes.get(productId);
        if (mode != null && !mode.isBlank()) {
            return mode;
        }
        return defaultMode != null && !defaultMode.isBlank() ? defaultMode : fallback;
    }
}
