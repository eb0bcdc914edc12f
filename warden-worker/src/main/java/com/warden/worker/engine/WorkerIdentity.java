package com.warden.worker.engine;

import com.warden.worker.wiring.WorkerProperties;
import org.springframework.stereotype.Component;

@Component
public class WorkerIdentity {
  private final String workerId;

  public WorkerIdentity(WorkerProperties props) {
    this.workerId = (props.id() == null || props.id().isBlank())
        ? WorkerIds.randomWorkerId()
        : props.id();
  }

  public String id() { return workerId; }
}
