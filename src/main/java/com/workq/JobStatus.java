package com.workq;

public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED
}
