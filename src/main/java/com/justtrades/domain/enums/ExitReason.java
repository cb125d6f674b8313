package com.justtrades.domain.enums;

public enum ExitReason {
    TAKE_PROFIT,
    STOP_LOSS,
    BREAK_EVEN,
    MANUAL,
    SIGNAL,
    REVERSAL,
    KILL_SWITCH
}
