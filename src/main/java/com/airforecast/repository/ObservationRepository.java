package com.airforecast.repository;

import com.airforecast.entity.ObservationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface ObservationRepository extends JpaRepository<ObservationRecord, Long> {

    List<ObservationRecord> findByCityIdAndObservedAtBetweenOrderByObservedAtAsc(
        String cityId, Instant from, Instant to
    );
}
