package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.EmployeeReconciliation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EmployeeReconciliationRepository extends JpaRepository<EmployeeReconciliation, UUID> {

    @Query("SELECT e FROM EmployeeReconciliation e WHERE e.payPeriod.periodId = :periodId " +
            "AND (:issuesOnly = false OR e.hasIssues = true) ORDER BY e.employeeId")
    List<EmployeeReconciliation> findByPeriodId(@Param("periodId") String periodId,
                                                @Param("issuesOnly") boolean issuesOnly);

    @Query("SELECT e FROM EmployeeReconciliation e WHERE e.run.id = :runId ORDER BY e.employeeId")
    List<EmployeeReconciliation> findByRunId(@Param("runId") UUID runId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM EmployeeReconciliation e WHERE e.payPeriod.periodId = :periodId")
    int deleteByPeriodId(@Param("periodId") String periodId);
}
