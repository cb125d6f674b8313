package com.justtrades.domain.enums;

/** What caused a drift check. */
public enum DriftTrigger {
    SCHEDULED,
    SNAPSHOT,
    EXIT
}
