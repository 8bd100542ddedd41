package com.airforecast.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class IrreparableGapException extends DataQualityException {
    private final Instant gapStart;
    private final int gapHours;

    public IrreparableGapException(String cityId, Instant gapStart, int gapHours, int maxGapHours) {
        super("IRREPARABLE_GAP",
              "City '" + cityId + "' is missing " + gapHours + " consecutive hours from " + gapStart
                  + "; at most " + maxGapHours + " may be imputed.");
        this.gapStart = gapStart;
        this.gapHours = gapHours;
    }
}
