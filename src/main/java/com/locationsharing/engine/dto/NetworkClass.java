package com.locationsharing.engine.dto;

public enum NetworkClass {
    WIFI,
    CELLULAR,
    NONE
}
