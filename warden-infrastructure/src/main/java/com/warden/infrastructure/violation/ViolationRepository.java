package com.warden.infrastructure.violation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ViolationRepository extends JpaRepository<ViolationEntity, Long> {

  List<ViolationEntity> findByJobIdOrderByIdAsc(Long jobId);

  List<ViolationEntity> findByJobIdInOrderByIdAsc(Collection<Long> jobIds);

  @Query("""
      SELECT v FROM ViolationEntity v
      WHERE v.jobId IN (
        SELECT j.id FROM JobEntity j
        WHERE j.deploymentId IN (SELECT d.id FROM DeploymentEntity d WHERE d.tenantId = :tenantId)
      )
      ORDER BY v.id ASC
      """)
  List<ViolationEntity> findByTenant(@Param("tenantId") String tenantId);
}
