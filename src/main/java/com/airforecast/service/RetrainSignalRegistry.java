package com.airforecast.service;

import com.airforecast.model.RetrainSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One pending retrain signal per city. A newer signal replaces an unconsumed one.
 */
@Slf4j
@Component
public class RetrainSignalRegistry {

    private final ConcurrentHashMap<String, RetrainSignal> pending = new ConcurrentHashMap<>();

    public void raise(RetrainSignal signal) {
        RetrainSignal replaced = pending.put(signal.cityId(), signal);
        log.info("Retrain signal raised | city={} | reason={} | replaced={}",
                 signal.cityId(), signal.reason(), replaced != null);
    }

    public Optional<RetrainSignal> consume(String cityId) {
        return Optional.ofNullable(pending.remove(cityId));
    }

    /** Puts back a consumed signal unless a newer one arrived meanwhile. */
    public void restore(RetrainSignal signal) {
        pending.putIfAbsent(signal.cityId(), signal);
    }

    public Optional<RetrainSignal> peek(String cityId) {
        return Optional.ofNullable(pending.get(cityId));
    }

    public List<String> pendingCities() {
        return pending.keySet().stream().sorted().toList();
    }
}
