package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.enums.ExceptionStatus;
import com.PayRecon.recon_backend.enums.ReconType;
import com.PayRecon.recon_backend.enums.Severity;
import com.PayRecon.recon_backend.model.ReconciliationItem;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReconciliationItemRepository extends JpaRepository<ReconciliationItem, UUID> {

    @Query("SELECT i FROM ReconciliationItem i WHERE i.run.id = :runId ORDER BY i.severity, i.reconType, i.employeeId")
    List<ReconciliationItem> findByRunId(@Param("runId") UUID runId);

    @Query("SELECT i FROM ReconciliationItem i WHERE i.run.id = :runId AND " +
            "(:severity IS NULL OR i.severity = :severity) AND " +
            "(:status IS NULL OR i.status = :status) AND " +
            "(:reconType IS NULL OR i.reconType = :reconType)")
    Page<ReconciliationItem> findByCriteria(@Param("runId") UUID runId,
                                            @Param("severity") Severity severity,
                                            @Param("status") ExceptionStatus status,
                                            @Param("reconType") ReconType reconType,
                                            Pageable pageable);
}
