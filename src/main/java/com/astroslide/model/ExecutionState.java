package com.astroslide.model;

public enum ExecutionState {
    IDLE,
    VALIDATING,
    EXECUTING,
    DONE,
    FAILED
}
