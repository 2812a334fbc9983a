package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.model.CostAllocationRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CostAllocationRuleRepository extends JpaRepository<CostAllocationRule, UUID> {

    @Query("SELECT r FROM CostAllocationRule r WHERE r.payPeriod.periodId = :periodId " +
            "AND (:source IS NULL OR r.source = :source) ORDER BY r.employeeCode")
    List<CostAllocationRule> findByPeriodId(@Param("periodId") String periodId,
                                            @Param("source") AllocationSource source);

    @Query("SELECT r FROM CostAllocationRule r WHERE r.payPeriod.periodId = :periodId AND r.employeeCode = :employeeCode")
    Optional<CostAllocationRule> findByPeriodIdAndEmployeeCode(@Param("periodId") String periodId,
                                                               @Param("employeeCode") String employeeCode);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CostAllocationRule r WHERE r.payPeriod.periodId = :periodId AND r.source = :source")
    int deleteByPeriodIdAndSource(@Param("periodId") String periodId, @Param("source") AllocationSource source);
}
