package com.justtrades.domain.enums;

public enum DriftResolution {
    REBUILT_FROM_BROKER_FILLS,
    CORRECTED_TO_BROKER,
    UNRESOLVED
}
