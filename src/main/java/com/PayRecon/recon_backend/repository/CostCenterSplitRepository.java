package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.CostCenterSplit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CostCenterSplitRepository extends JpaRepository<CostCenterSplit, UUID> {
    List<CostCenterSplit> findByActiveTrue();

    List<CostCenterSplit> findBySourceAccountOrderByTargetAccountAsc(String sourceAccount);

    List<CostCenterSplit> findAllByOrderBySourceAccountAscTargetAccountAsc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CostCenterSplit s WHERE s.sourceAccount = :sourceAccount")
    int deleteBySource(@Param("sourceAccount") String sourceAccount);
}
