package com.brutesearch.orchestrator.entity;

public enum FetchStatus {
    SUCCESS,
    BLOCKED,
    FAILED
}
