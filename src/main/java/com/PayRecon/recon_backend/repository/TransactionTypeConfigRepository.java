package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.TransactionTypeConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionTypeConfigRepository extends JpaRepository<TransactionTypeConfig, UUID> {
    Optional<TransactionTypeConfig> findByTransactionType(String transactionType);

    List<TransactionTypeConfig> findByActiveTrue();
}
