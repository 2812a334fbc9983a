package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.LocationMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LocationMappingRepository extends JpaRepository<LocationMapping, UUID> {
    Optional<LocationMapping> findByTimesheetLocation(String timesheetLocation);

    List<LocationMapping> findByActiveTrueOrderByTimesheetLocationAsc();

    List<LocationMapping> findAllByOrderByTimesheetLocationAsc();
}
