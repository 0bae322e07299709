package com.rescuegrid.incident.entity;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
