package com.warden.domain.job;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTest {

  @Test
  void wireValuesMatchStoredStrings() {
    assertThat(JobStatus.QUEUED.wire()).isEqualTo("queued");
    assertThat(JobStatus.IN_PROGRESS.wire()).isEqualTo("in-progress");
    assertThat(JobStatus.fromWire("in-progress")).isEqualTo(JobStatus.IN_PROGRESS);
    assertThat(JobStatus.fromWire(" DONE ")).isEqualTo(JobStatus.DONE);
    assertThat(JobStatus.fromWire("in_progress")).isEqualTo(JobStatus.IN_PROGRESS);
  }

  @Test
  void unknownStatusIsRejected() {
    assertThatThrownBy(() -> JobStatus.fromWire("running")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> JobStatus.fromWire("")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void transitionsAreMonotonic() {
    assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.IN_PROGRESS)).isTrue();
    assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.DONE)).isFalse();
    assertThat(JobStatus.IN_PROGRESS.canTransitionTo(JobStatus.ERROR)).isTrue();
    assertThat(JobStatus.IN_PROGRESS.canTransitionTo(JobStatus.QUEUED)).isFalse();

    for (JobStatus terminal : new JobStatus[] {JobStatus.DONE, JobStatus.ERROR}) {
      assertThat(terminal.isTerminal()).isTrue();
      assertThat(terminal.canTransitionTo(JobStatus.QUEUED)).isFalse();
      assertThat(terminal.canTransitionTo(JobStatus.IN_PROGRESS)).isFalse();
      assertThat(terminal.canTransitionTo(JobStatus.DONE)).isTrue();
      assertThat(terminal.canTransitionTo(JobStatus.ERROR)).isTrue();
    }
  }
}
