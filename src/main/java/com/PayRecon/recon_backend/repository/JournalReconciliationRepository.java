package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.JournalReconciliation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JournalReconciliationRepository extends JpaRepository<JournalReconciliation, UUID> {

    @Query("SELECT j FROM JournalReconciliation j WHERE j.run.id = :runId ORDER BY j.description")
    List<JournalReconciliation> findByRunId(@Param("runId") UUID runId);
}
