package com.justtrades.domain.enums;

/**
 * States of the per-position exit controller.
 *
 * <p>IDLE is the only resting state. The other three exist only while an exit
 * is in flight and always resolve back to IDLE, either through broker-confirmed
 * flat or through the kill switch.
 */
public enum ExitState {
    IDLE,
    PREPARE_EXIT,
    WORKING_EXIT,
    CONFIRM_FLAT
}
