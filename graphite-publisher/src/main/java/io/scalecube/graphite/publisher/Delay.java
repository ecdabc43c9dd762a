package io.scalecube.graphite.publisher;

import org.agrona.concurrent.EpochClock;

class Delay {

  private final EpochClock epochClock;
  private final long defaultDelay;

  private long deadline;

  Delay(EpochClock epochClock, long defaultDelay) {
    this.epochClock = epochClock;
    this.defaultDelay = defaultDelay;
  }

  void delay() {
    deadline = epochClock.time() + defaultDelay;
  }

  boolean isNotOverdue() {
    return epochClock.time() < deadline;
  }
}
