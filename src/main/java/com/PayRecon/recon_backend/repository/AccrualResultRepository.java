package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.AccrualResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AccrualResultRepository extends JpaRepository<AccrualResult, UUID> {

    @Query("SELECT a FROM AccrualResult a WHERE a.payPeriod.periodId = :periodId ORDER BY a.employeeCode")
    List<AccrualResult> findByPeriodId(@Param("periodId") String periodId);
}
