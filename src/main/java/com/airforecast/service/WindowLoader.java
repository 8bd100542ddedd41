package com.airforecast.service;

import com.airforecast.config.ForecastProperties;
import com.airforecast.exception.DataInsufficientException;
import com.airforecast.exception.InvalidObservationStreamException;
import com.airforecast.exception.IrreparableGapException;
import com.airforecast.model.Observation;
import com.airforecast.model.ObservationWindow;
import com.airforecast.source.ObservationSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Assembles the contiguous W-hour window ending at a given hour.
 *
 * <p>Invalid readings count as missing. Interior runs of up to {@code maxGapHours}
 * missing hours are repaired: NO2 is interpolated linearly between the neighbouring
 * observed hours, covariates are carried forward from the previous hour. The first and
 * last hour of the window must be observed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WindowLoader {

    private final ObservationSource observationSource;
    private final ForecastProperties properties;

    public ObservationWindow load(String cityId, Instant endHour) {
        int hours = properties.getWindow().getHours();
        int maxGap = properties.getWindow().getMaxGapHours();
        Instant end = endHour.truncatedTo(ChronoUnit.HOURS);
        Instant start = end.minus(Duration.ofHours(hours - 1L));

        Observation[] slots = place(cityId, start, end, hours, observationSource.fetch(cityId, start, end));

        int present = 0;
        for (Observation o : slots) {
            if (o != null) {
                present++;
            }
        }
        if (present == 0) {
            throw new DataInsufficientException(cityId, start, end, "no valid observations");
        }
        if (slots[0] == null || slots[hours - 1] == null) {
            throw new DataInsufficientException(cityId, start, end,
                present + " of " + hours + " hours observed and the window edges are missing");
        }

        int imputed = 0;
        int i = 1;
        while (i < hours - 1) {
            if (slots[i] != null) {
                i++;
                continue;
            }
            int gapStart = i;
            while (slots[i] == null) {
                i++;
            }
            int gapLength = i - gapStart;
            if (gapLength > maxGap) {
                throw new IrreparableGapException(cityId, slotTime(start, gapStart), gapLength, maxGap);
            }
            fill(slots, gapStart, i, start);
            imputed += gapLength;
        }

        if (imputed > 0) {
            log.info("Window repaired | city={} | end={} | imputedHours={}", cityId, end, imputed);
        }
        return new ObservationWindow(cityId, end, List.of(slots), imputed);
    }

    /** Places valid observations on their hour slot, rejecting malformed streams. */
    private Observation[] place(String cityId, Instant start, Instant end, int hours, List<Observation> fetched) {
        Observation[] slots = new Observation[hours];
        Instant previous = null;
        for (Observation o : fetched) {
            if (o.cityId() != null && !o.cityId().equals(cityId)) {
                throw new InvalidObservationStreamException(
                    "Observation for city '" + o.cityId() + "' returned while loading '" + cityId + "'");
            }
            Instant hour = o.observedAt().truncatedTo(ChronoUnit.HOURS);
            if (previous != null && !hour.isAfter(previous)) {
                throw new InvalidObservationStreamException(
                    "Observations for city '" + cityId + "' are duplicated or out of order at " + hour);
            }
            previous = hour;
            if (hour.isBefore(start) || hour.isAfter(end)) {
                continue;
            }
            if (!o.valid() || !Double.isFinite(o.no2())) {
                continue;
            }
            int slot = (int) Duration.between(start, hour).toHours();
            slots[slot] = o.withTimestamp(hour);
        }
        return slots;
    }

    /** Fills {@code slots[from, to)} using the observed neighbours at {@code from - 1} and {@code to}. */
    private void fill(Observation[] slots, int from, int to, Instant start) {
        Observation before = slots[from - 1];
        Observation after = slots[to];
        int span = to - (from - 1);
        for (int j = from; j < to; j++) {
            double fraction = (double) (j - (from - 1)) / span;
            double no2 = before.no2() + fraction * (after.no2() - before.no2());
            slots[j] = before.withTimestamp(slotTime(start, j)).withNo2(no2);
        }
    }

    private static Instant slotTime(Instant start, int slot) {
        return start.plus(Duration.ofHours(slot));
    }
}
