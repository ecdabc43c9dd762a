package io.scalecube.graphite.publisher;

import java.io.IOException;
import java.time.Duration;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentTerminationException;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class GraphitePublisherAgent implements Agent {

  private static final Logger LOGGER = LoggerFactory.getLogger(GraphitePublisherAgent.class);

  public enum State {
    INIT,
    RUNNING,
    CLEANUP,
    CLOSED
  }

  private final GraphiteFlusher flusher;

  private final Delay flushInterval;
  private State state = State.CLOSED;

  GraphitePublisherAgent(GraphiteFlusher flusher, EpochClock epochClock, Duration flushInterval) {
    this.flusher = flusher;
    this.flushInterval = new Delay(epochClock, flushInterval.toMillis());
  }

  @Override
  public String roleName() {
    return "GraphitePublisherAgent";
  }

  @Override
  public void onStart() {
    if (state != State.CLOSED) {
      throw new AgentTerminationException("Illegal state: " + state);
    }
    state(State.INIT);
  }

  @Override
  public int doWork() {
    try {
      return switch (state) {
        case INIT -> init();
        case RUNNING -> running();
        case CLEANUP -> cleanup();
        default -> throw new AgentTerminationException("Unknown state: " + state);
      };
    } catch (AgentTerminationException e) {
      throw e;
    } catch (Exception e) {
      state(State.CLEANUP);
      throw e;
    }
  }

  private int init() {
    // first flush happens one full interval after start
    flushInterval.delay();

    state(State.RUNNING);
    LOGGER.info("[{}] Initialized, now running", roleName());
    return 1;
  }

  private int running() {
    if (flushInterval.isNotOverdue()) {
      return 0;
    }

    flushInterval.delay();

    try {
      final var written = flusher.flush();
      LOGGER.debug("[{}] Published {} lines to {}", roleName(), written, flusher.address());
    } catch (IOException e) {
      LOGGER.warn(
          "[{}] Failed to publish metrics to {}: {}", roleName(), flusher.address(), e.toString());
    }
    return 1;
  }

  private int cleanup() {
    State previous = state;
    if (previous != State.CLOSED) { // when it comes from onClose()
      state(State.INIT);
    }
    return 1;
  }

  @Override
  public void onClose() {
    state(State.CLOSED);
    cleanup();
  }

  private void state(State state) {
    LOGGER.debug("[{}][state] {}->{}", roleName(), this.state, state);
    this.state = state;
  }

  public State state() {
    return state;
  }
}
