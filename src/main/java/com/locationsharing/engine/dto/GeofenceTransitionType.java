package com.locationsharing.engine.dto;

public enum GeofenceTransitionType {
    ENTER,
    EXIT
}
