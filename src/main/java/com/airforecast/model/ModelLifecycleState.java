package com.airforecast.model;

public enum ModelLifecycleState {
    UNTRAINED,
    TRAINED
}
