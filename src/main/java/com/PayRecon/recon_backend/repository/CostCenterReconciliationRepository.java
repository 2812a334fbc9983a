package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.CostCenterReconciliation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CostCenterReconciliationRepository extends JpaRepository<CostCenterReconciliation, UUID> {

    @Query("SELECT c FROM CostCenterReconciliation c WHERE c.run.id = :runId ORDER BY c.costCenter")
    List<CostCenterReconciliation> findByRunId(@Param("runId") UUID runId);
}
