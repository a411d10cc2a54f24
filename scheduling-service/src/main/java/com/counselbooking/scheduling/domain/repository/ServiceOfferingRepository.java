package com.counselbooking.scheduling.domain.repository;

import com.counselbooking.scheduling.domain.model.ServiceOffering;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, Long> {

    Optional<ServiceOffering> findByIdAndActiveTrue(Long id);
}
