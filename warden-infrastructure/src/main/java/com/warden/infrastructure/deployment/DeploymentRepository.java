package com.warden.infrastructure.deployment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DeploymentRepository extends JpaRepository<DeploymentEntity, Long> {

  /** Deployments the cron scheduler evaluates: enabled and carrying a schedule. */
  List<DeploymentEntity> findByEnabledTrueAndScheduleIsNotNullOrderByIdAsc();

  List<DeploymentEntity> findByTenantIdOrderByIdAsc(String tenantId);

  Optional<DeploymentEntity> findByIdAndTenantId(Long id, String tenantId);

  @Modifying
  @Query("UPDATE DeploymentEntity d SET d.lastScheduledAt = :at WHERE d.id = :id")
  int markScheduled(@Param("id") Long id, @Param("at") Instant at);
}
