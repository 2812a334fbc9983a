package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.PayCompCodeMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PayCompCodeMappingRepository extends JpaRepository<PayCompCodeMapping, String> {
}
