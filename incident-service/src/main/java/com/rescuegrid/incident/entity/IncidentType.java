package com.rescuegrid.incident.entity;

public enum IncidentType {
    FIRE,
    MEDICAL,
    ACCIDENT,
    CRIME,
    NATURAL_DISASTER,
    HAZMAT,
    OTHER
}
