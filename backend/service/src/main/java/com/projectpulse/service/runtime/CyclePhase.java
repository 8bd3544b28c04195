package com.projectpulse.service.runtime;

public enum CyclePhase {
    IDLE,
    COLLECTING,
    SELECTING,
    PUBLISHING,
    RECORDING
}
