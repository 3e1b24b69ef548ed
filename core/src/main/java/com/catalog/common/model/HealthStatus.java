package com.catalog.common.model;

public enum HealthStatus {
    HEALTHY, WARNING, ERROR, UNKNOWN
}
