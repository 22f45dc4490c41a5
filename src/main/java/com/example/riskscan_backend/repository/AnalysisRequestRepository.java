package com.example.riskscan_backend.repository;

import com.example.riskscan_backend.model.AnalysisRequest;
import com.example.riskscan_backend.util.RequestState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface AnalysisRequestRepository extends JpaRepository<AnalysisRequest, UUID> {

    @Query("""
       select r.id from AnalysisRequest r
       where r.state in :states
         and (r.nextWakeAt is null or r.nextWakeAt <= :now)
       order by r.updatedAt
    """)
    List<UUID> findDueIds(@Param("states") Collection<RequestState> states,
                          @Param("now") Instant now,
                          Pageable pageable);
}
