package com.di.userflow.source;

public enum GateStatus {
    READY,
    TIMED_OUT,
    CANCELLED
}
