package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.enums.PeriodStatus;
import com.PayRecon.recon_backend.model.PayPeriod;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PayPeriodRepository extends JpaRepository<PayPeriod, String> {

    @Query("SELECT p FROM PayPeriod p WHERE (:status IS NULL OR p.status = :status)")
    Page<PayPeriod> findByCriteria(@Param("status") PeriodStatus status, Pageable pageable);
}
