package com.warden.worker.engine;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

final class WorkerIds {
  private WorkerIds() {}

  static String randomWorkerId() {
    return "worker-" + hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }
}
