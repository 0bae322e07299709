package com.rescuegrid.dispatch.entity;

public enum UnitType {
    AMBULANCE,
    FIRE_TRUCK,
    POLICE,
    RESCUE,
    HAZMAT
}
