package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.JournalDescriptionMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JournalDescriptionMappingRepository extends JpaRepository<JournalDescriptionMapping, UUID> {
    Optional<JournalDescriptionMapping> findByDescription(String description);

    List<JournalDescriptionMapping> findByActiveTrue();
}
