package com.example.riskscan_backend.repository;

import com.example.riskscan_backend.model.AnalysisReport;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface AnalysisReportRepository extends JpaRepository<AnalysisReport, UUID> {
    Optional<AnalysisReport> findByRequestId(UUID requestId);
}
