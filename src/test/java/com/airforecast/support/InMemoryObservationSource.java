package com.airforecast.support;

import com.airforecast.model.Observation;
import com.airforecast.source.ObservationSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryObservationSource implements ObservationSource {

    private final Map<String, NavigableMap<Instant, Observation>> byCity = new ConcurrentHashMap<>();

    public InMemoryObservationSource add(Collection<Observation> observations) {
        for (Observation o : observations) {
            byCity.computeIfAbsent(o.cityId(), c -> new ConcurrentSkipListMap<>()).put(o.observedAt(), o);
        }
        return this;
    }

    public void remove(String cityId, Instant at) {
        NavigableMap<Instant, Observation> series = byCity.get(cityId);
        if (series != null) {
            series.remove(at);
        }
    }

    public void replace(Observation observation) {
        add(List.of(observation));
    }

    @Override
    public List<Observation> fetch(String cityId, Instant from, Instant to) {
        NavigableMap<Instant, Observation> series = byCity.get(cityId);
        if (series == null) {
            return List.of();
        }
        return new ArrayList<>(series.subMap(from, true, to, true).values());
    }
}
