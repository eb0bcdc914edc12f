package com.warden.infrastructure.catalog;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface IntegrationRepository extends JpaRepository<IntegrationEntity, Long> {

  Optional<IntegrationEntity> findByName(String name);

  boolean existsByName(String name);

  List<IntegrationEntity> findAllByOrderByIdAsc();
}
