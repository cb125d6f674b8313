package com.justtrades.exception;

import java.util.Map;

public class OrderNotFoundException extends BaseException {

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.NOT_FOUND, "Order not found at broker: " + orderId, Map.of("orderId", orderId));
    }
}
