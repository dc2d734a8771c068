package com.shopflow.order.entity;

public enum PaymentMethod {
    PAYPAL,
    COD
}
