package com.powerguard.core.model;

public enum ExecutionStatus {
    SUCCESS,
    FAILED,
    UNSUPPORTED
}
