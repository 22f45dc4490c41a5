package com.example.riskscan_backend.repository;

import com.example.riskscan_backend.model.AnalysisEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AnalysisEventRepository extends JpaRepository<AnalysisEvent, Long> {
    List<AnalysisEvent> findByRequestIdOrderByIdAsc(UUID requestId);
}
