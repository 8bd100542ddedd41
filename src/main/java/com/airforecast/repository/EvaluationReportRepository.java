package com.airforecast.repository;

import com.airforecast.entity.EvaluationReport;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface EvaluationReportRepository extends JpaRepository<EvaluationReport, UUID> {

    List<EvaluationReport> findByCityIdAndModelVersionOrderByEvaluatedAtDesc(
        String cityId, String modelVersion, Pageable pageable
    );
}
