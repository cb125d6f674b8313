package com.justtrades.event;

public enum OrderEventType {
    PLACED,
    FILLED,
    CANCELLED,
    REJECTED
}
