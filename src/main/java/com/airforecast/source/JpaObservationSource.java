package com.airforecast.source;

import com.airforecast.entity.ObservationRecord;
import com.airforecast.model.Observation;
import com.airforecast.repository.ObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaObservationSource implements ObservationSource {

    private final ObservationRepository observationRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Observation> fetch(String cityId, Instant from, Instant to) {
        List<Observation> observations = observationRepository
            .findByCityIdAndObservedAtBetweenOrderByObservedAtAsc(cityId, from, to)
            .stream()
            .map(ObservationRecord::toObservation)
            .toList();
        log.debug("Fetched observations | city={} | from={} | to={} | rows={}",
                  cityId, from, to, observations.size());
        return observations;
    }
}
