package com.warden.api.tenant;

import com.warden.api.dispatch.ViolationView;

import java.time.Instant;
import java.util.List;

/** One job of a deployment with the violations it produced. */
public record JobViolations(
    long jobId,
    String status,
    Instant createdAt,
    Instant finishedAt,
    List<ViolationView> violations
) {}
