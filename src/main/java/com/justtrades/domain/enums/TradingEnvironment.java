package com.justtrades.domain.enums;

public enum TradingEnvironment {
    DEMO,
    LIVE
}
