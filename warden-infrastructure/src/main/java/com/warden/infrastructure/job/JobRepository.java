package com.warden.infrastructure.job;

import com.warden.domain.job.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface JobRepository extends JpaRepository<JobEntity, Long>, JobRepositoryCustom {

  /** Jobs of one deployment, most recently finished first; unfinished jobs ordered by creation. */
  @Query("""
      SELECT j FROM JobEntity j
      WHERE j.deploymentId = :deploymentId
      ORDER BY COALESCE(j.finishedAt, j.createdAt) DESC, j.id DESC
      """)
  List<JobEntity> findByDeploymentRecentFirst(@Param("deploymentId") Long deploymentId);

  @Query("""
      SELECT j FROM JobEntity j
      WHERE j.id = :id
        AND j.deploymentId IN (SELECT d.id FROM DeploymentEntity d WHERE d.tenantId = :tenantId)
      """)
  Optional<JobEntity> findForTenant(@Param("id") Long id, @Param("tenantId") String tenantId);

  long countByStatus(JobStatus status);
}
