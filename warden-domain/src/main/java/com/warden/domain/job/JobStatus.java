package com.warden.domain.job;

import java.util.Locale;

/**
 * Job lifecycle states.
 *
 * Transitions:
 * QUEUED → IN_PROGRESS → {DONE, ERROR}
 *
 * A terminal job may be completed again (last writer wins) but never leaves the terminal set.
 */
public enum JobStatus {

  QUEUED("queued"),
  IN_PROGRESS("in-progress"),
  DONE("done"),
  ERROR("error");

  private final String wire;

  JobStatus(String wire) {
    this.wire = wire;
  }

  /** Value stored in the jobs table and exchanged over HTTP. */
  public String wire() {
    return wire;
  }

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }

  public boolean canTransitionTo(JobStatus next) {
    if (next == null) return false;
    return switch (this) {
      case QUEUED -> next == IN_PROGRESS;
      case IN_PROGRESS, DONE, ERROR -> next.isTerminal();
    };
  }

  public static JobStatus fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing job status");
    }
    String v = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (JobStatus s : values()) {
      if (s.wire.equals(v)) return s;
    }
    throw new IllegalArgumentException("Unknown job status: " + raw);
  }

  @Override
  public String toString() {
    return wire;
  }
}
