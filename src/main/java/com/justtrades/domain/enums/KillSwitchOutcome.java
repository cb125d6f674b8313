package com.justtrades.domain.enums;

public enum KillSwitchOutcome {
    FLAT_CONFIRMED,
    ALREADY_FLAT,
    ALREADY_RUNNING,
    DEADLINE_EXCEEDED
}
