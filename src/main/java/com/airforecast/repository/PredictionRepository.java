package com.airforecast.repository;

import com.airforecast.entity.PredictionRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PredictionRepository extends JpaRepository<PredictionRecord, UUID> {

    Optional<PredictionRecord> findFirstByCityIdAndAsOfAndModelVersion(
        String cityId, Instant asOf, String modelVersion
    );

    Page<PredictionRecord> findByCityIdOrderByAsOfDesc(String cityId, Pageable pageable);

    /** Forecasts whose whole horizon ended at or before {@code cutoff} and that are not yet scored. */
    @Query("""
        SELECT p FROM PredictionRecord p
        WHERE p.cityId = :cityId
          AND p.evaluated = false
          AND p.asOf <= :cutoff
        ORDER BY p.asOf ASC
    """)
    List<PredictionRecord> findDueForEvaluation(
        @Param("cityId") String cityId,
        @Param("cutoff") Instant cutoff
    );
}
