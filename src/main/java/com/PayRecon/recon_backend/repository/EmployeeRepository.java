package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.model.Employee;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, String> {

    @Query("SELECT e FROM Employee e WHERE " +
            "(:search IS NULL OR LOWER(e.code) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.firstName) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.surname) LIKE LOWER(CONCAT('%', :search, '%'))) AND " +
            "(:employmentType IS NULL OR e.employmentType = :employmentType)")
    Page<Employee> searchEmployees(@Param("search") String search,
                                   @Param("employmentType") String employmentType,
                                   Pageable pageable);

    @Query("SELECT e FROM Employee e WHERE e.autoPay = true AND e.autoPayAmount > 0")
    List<Employee> findAutoPayEmployees();
}
