package com.devflow.orchestrator.quality;

public enum CheckStatus {
    PASS,
    FAIL
}
