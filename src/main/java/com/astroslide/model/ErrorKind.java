package com.astroslide.model;

public enum ErrorKind {
    INVALID_PARAMETER,
    DEGENERATE_INPUT,
    CAPACITY_EXCEEDED,
    TIMEOUT,
    CANCELLED,
    INTERNAL
}
