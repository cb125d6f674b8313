package com.justtrades.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
