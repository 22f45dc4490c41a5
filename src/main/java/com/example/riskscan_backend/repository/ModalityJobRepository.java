package com.example.riskscan_backend.repository;

import com.example.riskscan_backend.model.ModalityJob;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ModalityJobRepository extends JpaRepository<ModalityJob, UUID> {
    List<ModalityJob> findByRequestIdOrderByModality(UUID requestId);
}
