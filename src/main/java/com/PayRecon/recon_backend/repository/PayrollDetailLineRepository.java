package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.PayrollDetailLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PayrollDetailLineRepository extends JpaRepository<PayrollDetailLine, UUID> {

    @Query("SELECT l FROM PayrollDetailLine l WHERE l.payPeriod.periodId = :periodId")
    List<PayrollDetailLine> findByPeriodId(@Param("periodId") String periodId);

    @Query("SELECT COUNT(l) FROM PayrollDetailLine l WHERE l.payPeriod.periodId = :periodId")
    long countByPeriodId(@Param("periodId") String periodId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM PayrollDetailLine l WHERE l.payPeriod.periodId = :periodId")
    int deleteByPeriodId(@Param("periodId") String periodId);
}
