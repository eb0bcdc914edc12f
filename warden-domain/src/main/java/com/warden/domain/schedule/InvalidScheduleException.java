package com.warden.domain.schedule;

import com.warden.domain.error.ValidationException;

/**
 * Cron expression that cannot be parsed.
 * Rejected with 400 at deployment write time; skipped per tick by the scheduler.
 */
public class InvalidScheduleException extends ValidationException {

  private final String expression;

  public InvalidScheduleException(String expression, Throwable cause) {
    super("Invalid cron expression for schedule: " + expression, cause);
    this.expression = expression;
  }

  public String expression() {
    return expression;
  }
}
