package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.ReconciliationRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ReconciliationRunRepository extends JpaRepository<ReconciliationRun, UUID> {

    @Query("SELECT r FROM ReconciliationRun r WHERE r.payPeriod.periodId = :periodId")
    Page<ReconciliationRun> findByPeriodId(@Param("periodId") String periodId, Pageable pageable);
}
