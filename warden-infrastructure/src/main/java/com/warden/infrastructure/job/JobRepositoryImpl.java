package com.warden.infrastructure.job;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JobRepositoryImpl implements JobRepositoryCustom {

  private static final Logger log = LoggerFactory.getLogger(JobRepositoryImpl.class);

  /** Upper bound on lost conditional updates before a claim gives up for this call. */
  static final int MAX_CLAIM_ATTEMPTS = 16;

  @PersistenceContext
  private EntityManager em;

  @Override
  @Transactional
  public Optional<Long> claimNext(String queue, Instant now) {
    for (int attempt = 1; attempt <= MAX_CLAIM_ATTEMPTS; attempt++) {
      // Lock the candidate so concurrent claimants skip it. The deployment filter is a
      // subquery so only the job row is locked.
      List<?> rows = em.createNativeQuery(
          "SELECT j.id FROM jobs j " +
              "WHERE j.status = 'queued' " +
              "AND j.deployment_id IN (SELECT d.id FROM deployments d WHERE d.queue = :queue) " +
              "ORDER BY j.created_at ASC, j.id ASC " +
              "LIMIT 1 " +
              "FOR UPDATE SKIP LOCKED"
      )
          .setParameter("queue", queue)
          .getResultList();

      if (rows.isEmpty()) return Optional.empty();

      long id = ((Number) rows.get(0)).longValue();
      int updated = em.createNativeQuery(
          "UPDATE jobs SET status = 'in-progress', started_at = :now " +
              "WHERE id = :id AND status = 'queued'"
      )
          .setParameter("now", now)
          .setParameter("id", id)
          .executeUpdate();

      if (updated == 1) return Optional.of(id);
      log.debug("Lost claim race for job {} on queue {} (attempt {})", id, queue, attempt);
    }
    log.warn("Claim on queue {} gave up after {} lost races", queue, MAX_CLAIM_ATTEMPTS);
    return Optional.empty();
  }

  @Override
  @Transactional
  public int deleteFinishedBetween(Instant after, Instant before) {
    if (after == null && before == null) {
      throw new IllegalArgumentException("At least one bound is required");
    }
    StringBuilder jpql = new StringBuilder("DELETE FROM JobEntity j WHERE j.finishedAt IS NOT NULL");
    Map<String, Object> params = new LinkedHashMap<>();
    if (after != null) {
      jpql.append(" AND j.finishedAt >= :after");
      params.put("after", after);
    }
    if (before != null) {
      jpql.append(" AND j.finishedAt <= :before");
      params.put("before", before);
    }
    var q = em.createQuery(jpql.toString());
    params.forEach(q::setParameter);
    int deleted = q.executeUpdate();
    em.clear();
    return deleted;
  }

  @Override
  @Transactional(readOnly = true)
  public Page<JobEntity> findTenantJobs(String tenantId, Long deploymentId, Instant after, Instant before, Pageable pageable) {
    StringBuilder where = new StringBuilder(
        " WHERE j.deploymentId IN (SELECT d.id FROM DeploymentEntity d WHERE d.tenantId = :tenantId)");
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("tenantId", tenantId);
    if (deploymentId != null) {
      where.append(" AND j.deploymentId = :deploymentId");
      params.put("deploymentId", deploymentId);
    }
    if (after != null) {
      where.append(" AND j.finishedAt >= :after");
      params.put("after", after);
    }
    if (before != null) {
      where.append(" AND j.finishedAt <= :before");
      params.put("before", before);
    }

    TypedQuery<Long> count = em.createQuery("SELECT count(j) FROM JobEntity j" + where, Long.class);
    params.forEach(count::setParameter);
    long total = count.getSingleResult();

    TypedQuery<JobEntity> select = em.createQuery(
        "SELECT j FROM JobEntity j" + where + " ORDER BY j.createdAt DESC, j.id DESC", JobEntity.class);
    params.forEach(select::setParameter);
    select.setFirstResult((int) pageable.getOffset());
    select.setMaxResults(pageable.getPageSize());

    return new PageImpl<>(select.getResultList(), pageable, total);
  }
}
