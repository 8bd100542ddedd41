package com.airforecast.model;

/**
 * A monitored city. Cities come from configuration and never change at runtime.
 *
 * @param presetSeed seed fixed in configuration, or {@code null} to derive one
 */
public record City(String id, String name, Integer presetSeed) {
}
