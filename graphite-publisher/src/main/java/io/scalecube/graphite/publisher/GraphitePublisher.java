package io.scalecube.graphite.publisher;

import static java.util.concurrent.atomic.AtomicIntegerFieldUpdater.newUpdater;

import io.scalecube.graphite.metrics.MetricsSource;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Objects;
import java.util.Properties;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import javax.net.SocketFactory;
import org.agrona.CloseHelper;
import org.agrona.ErrorHandler;
import org.agrona.LangUtil;
import org.agrona.SystemUtil;
import org.agrona.concurrent.AgentInvoker;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.SystemEpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Component that periodically publishes metrics of a {@link MetricsSource} to Graphite using the
 * plaintext protocol. Every flush interval a new connection is opened, all metrics are written, and
 * the connection is closed. First flush happens one flush interval after launch. Failed flushes are
 * logged, and publishing continues at the next interval.
 *
 * <p>For one-off publishing (with custom retry policy) see {@link #once(Context)} and {@link
 * GraphiteFlusher}.
 */
public class GraphitePublisher implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(GraphitePublisher.class);

  private final Context context;

  private final AgentInvoker agentInvoker;
  private final AgentRunner agentRunner;

  private GraphitePublisher(Context context) {
    context.conclude();
    this.context = context;

    final var agent =
        new GraphitePublisherAgent(
            newFlusher(context), context.epochClock(), context.flushInterval());

    if (context.useAgentInvoker()) {
      agentRunner = null;
      agentInvoker = new AgentInvoker(context.errorHandler(), null, agent);
    } else {
      agentInvoker = null;
      agentRunner = new AgentRunner(context.idleStrategy(), context.errorHandler(), null, agent);
    }
  }

  /**
   * Launch {@link GraphitePublisher} with provided {@link Context}.
   *
   * @param context context
   * @return newly started {@link GraphitePublisher}
   */
  public static GraphitePublisher launch(Context context) {
    final var publisher = new GraphitePublisher(context);
    if (publisher.agentInvoker != null) {
      publisher.agentInvoker.start();
    } else {
      AgentRunner.startOnThread(publisher.agentRunner);
    }
    return publisher;
  }

  /**
   * Performs single flush synchronously, in the caller thread.
   *
   * @param context context
   * @return number of lines written
   * @throws IOException if connection to Graphite could not be established
   */
  public static int once(Context context) throws IOException {
    context.conclude();
    return newFlusher(context).flush();
  }

  private static GraphiteFlusher newFlusher(Context context) {
    return new GraphiteFlusher(
        context.address(),
        context.metricsSource(),
        context.epochClock(),
        context.socketFactory(),
        context.connectTimeout(),
        new GraphiteSerializer(
            context.prefix(),
            context.flushInterval(),
            context.durationUnit(),
            context.percentiles()));
  }

  /**
   * Returns {@link Context} instance.
   *
   * @return {@link Context} instance
   */
  public Context context() {
    return context;
  }

  /**
   * Returns {@link AgentInvoker} instance when running without threads, or null if running with
   * {@link AgentRunner}.
   *
   * @return {@link AgentInvoker} instance, or null
   */
  public AgentInvoker agentInvoker() {
    return agentInvoker;
  }

  @Override
  public void close() {
    CloseHelper.quietCloseAll(agentInvoker, agentRunner);
  }

  public static class Context {

    public static final String ADDRESS_PROP_NAME = "scalecube.graphite.publisher.address";
    public static final String FLUSH_INTERVAL_PROP_NAME =
        "scalecube.graphite.publisher.flushInterval";
    public static final String DURATION_UNIT_PROP_NAME =
        "scalecube.graphite.publisher.durationUnit";
    public static final String PREFIX_PROP_NAME = "scalecube.graphite.publisher.prefix";
    public static final String PERCENTILES_PROP_NAME = "scalecube.graphite.publisher.percentiles";
    public static final String CONNECT_TIMEOUT_PROP_NAME =
        "scalecube.graphite.publisher.connectTimeout";
    public static final String IDLE_STRATEGY_PROP_NAME =
        "scalecube.graphite.publisher.idleStrategy";

    private static final double[] DEFAULT_PERCENTILES = {0.5, 0.75, 0.95, 0.99, 0.999};

    private static final AtomicIntegerFieldUpdater<Context> IS_CONCLUDED_UPDATER =
        newUpdater(Context.class, "isConcluded");

    private volatile int isConcluded;

    private InetSocketAddress address;
    private MetricsSource metricsSource;
    private Duration flushInterval;
    private Duration durationUnit;
    private String prefix;
    private double[] percentiles;
    private Duration connectTimeout;
    private SocketFactory socketFactory;
    private EpochClock epochClock;
    private boolean useAgentInvoker;
    private ErrorHandler errorHandler;
    private IdleStrategy idleStrategy;

    public Context() {}

    /**
     * Constructor, populates context from given properties.
     *
     * @param props properties, see {@code *_PROP_NAME} constants
     */
    public Context(Properties props) {
      address(props.getProperty(ADDRESS_PROP_NAME));
      flushInterval(props.getProperty(FLUSH_INTERVAL_PROP_NAME));
      durationUnit(props.getProperty(DURATION_UNIT_PROP_NAME));
      prefix(props.getProperty(PREFIX_PROP_NAME));
      percentiles(props.getProperty(PERCENTILES_PROP_NAME));
      connectTimeout(props.getProperty(CONNECT_TIMEOUT_PROP_NAME));
      idleStrategy(props.getProperty(IDLE_STRATEGY_PROP_NAME));
    }

    private void conclude() {
      if (0 != IS_CONCLUDED_UPDATER.getAndSet(this, 1)) {
        throw new ConcurrentModificationException();
      }

      Objects.requireNonNull(address, "address");
      Objects.requireNonNull(metricsSource, "metricsSource");

      if (flushInterval == null) {
        flushInterval = Duration.ofSeconds(10);
      }
      if (flushInterval.toMillis() <= 0) {
        throw new IllegalArgumentException("flushInterval must be at least 1ms: " + flushInterval);
      }

      if (durationUnit == null) {
        durationUnit = Duration.ofNanos(1);
      }
      if (durationUnit.isNegative() || durationUnit.isZero()) {
        throw new IllegalArgumentException("durationUnit must be positive: " + durationUnit);
      }

      if (prefix == null) {
        prefix = "";
      }

      if (percentiles == null) {
        percentiles = DEFAULT_PERCENTILES.clone();
      }
      for (double percentile : percentiles) {
        if (!(percentile >= 0.0 && percentile <= 1.0)) {
          throw new IllegalArgumentException("percentile must be in range [0, 1]: " + percentile);
        }
      }

      if (connectTimeout == null) {
        connectTimeout = Duration.ofSeconds(5);
      }

      if (socketFactory == null) {
        socketFactory = SocketFactory.getDefault();
      }

      if (epochClock == null) {
        epochClock = SystemEpochClock.INSTANCE;
      }

      if (errorHandler == null) {
        errorHandler = ex -> LOGGER.error("Exception occurred: ", ex);
      }

      if (idleStrategy == null) {
        idleStrategy = new BackoffIdleStrategy();
      }
    }

    public InetSocketAddress address() {
      return address;
    }

    public Context address(InetSocketAddress address) {
      this.address = address;
      return this;
    }

    /**
     * Setter for address.
     *
     * @param address address in form {@code host:port}
     * @return this
     */
    public Context address(String address) {
      if (address != null) {
        final var index = address.lastIndexOf(':');
        if (index <= 0 || index == address.length() - 1) {
          throw new IllegalArgumentException("Invalid address (expected host:port): " + address);
        }
        this.address =
            new InetSocketAddress(
                address.substring(0, index), Integer.parseInt(address.substring(index + 1)));
      }
      return this;
    }

    public MetricsSource metricsSource() {
      return metricsSource;
    }

    public Context metricsSource(MetricsSource metricsSource) {
      this.metricsSource = metricsSource;
      return this;
    }

    public Duration flushInterval() {
      return flushInterval;
    }

    public Context flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    public Context flushInterval(String flushInterval) {
      if (flushInterval != null) {
        this.flushInterval =
            Duration.ofNanos(SystemUtil.parseDuration("flushInterval", flushInterval));
      }
      return this;
    }

    public Duration durationUnit() {
      return durationUnit;
    }

    public Context durationUnit(Duration durationUnit) {
      this.durationUnit = durationUnit;
      return this;
    }

    public Context durationUnit(String durationUnit) {
      if (durationUnit != null) {
        this.durationUnit =
            Duration.ofNanos(SystemUtil.parseDuration("durationUnit", durationUnit));
      }
      return this;
    }

    public String prefix() {
      return prefix;
    }

    public Context prefix(String prefix) {
      this.prefix = prefix;
      return this;
    }

    public double[] percentiles() {
      return percentiles;
    }

    public Context percentiles(double... percentiles) {
      this.percentiles = percentiles;
      return this;
    }

    /**
     * Setter for percentiles.
     *
     * @param percentiles comma-separated fractions, like {@code 0.5,0.99}
     * @return this
     */
    public Context percentiles(String percentiles) {
      if (percentiles != null) {
        this.percentiles =
            Arrays.stream(percentiles.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .mapToDouble(Double::parseDouble)
                .toArray();
      }
      return this;
    }

    public Duration connectTimeout() {
      return connectTimeout;
    }

    public Context connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Context connectTimeout(String connectTimeout) {
      if (connectTimeout != null) {
        this.connectTimeout =
            Duration.ofNanos(SystemUtil.parseDuration("connectTimeout", connectTimeout));
      }
      return this;
    }

    public SocketFactory socketFactory() {
      return socketFactory;
    }

    public Context socketFactory(SocketFactory socketFactory) {
      this.socketFactory = socketFactory;
      return this;
    }

    public EpochClock epochClock() {
      return epochClock;
    }

    public Context epochClock(EpochClock epochClock) {
      this.epochClock = epochClock;
      return this;
    }

    public boolean useAgentInvoker() {
      return useAgentInvoker;
    }

    public Context useAgentInvoker(boolean useAgentInvoker) {
      this.useAgentInvoker = useAgentInvoker;
      return this;
    }

    public ErrorHandler errorHandler() {
      return errorHandler;
    }

    public Context errorHandler(ErrorHandler errorHandler) {
      this.errorHandler = errorHandler;
      return this;
    }

    public IdleStrategy idleStrategy() {
      return idleStrategy;
    }

    public Context idleStrategy(IdleStrategy idleStrategy) {
      this.idleStrategy = idleStrategy;
      return this;
    }

    public Context idleStrategy(String idleStrategy) {
      if (idleStrategy != null) {
        try {
          this.idleStrategy =
              (IdleStrategy) Class.forName(idleStrategy).getConstructor().newInstance();
        } catch (Exception ex) {
          LangUtil.rethrowUnchecked(ex);
        }
      }
      return this;
    }

    @Override
    public String toString() {
      return new StringJoiner(", ", Context.class.getSimpleName() + "[", "]")
          .add("address=" + address)
          .add("metricsSource=" + metricsSource)
          .add("flushInterval=" + flushInterval)
          .add("durationUnit=" + durationUnit)
          .add("prefix='" + prefix + "'")
          .add("percentiles=" + Arrays.toString(percentiles))
          .add("connectTimeout=" + connectTimeout)
          .add("socketFactory=" + socketFactory)
          .add("epochClock=" + epochClock)
          .add("useAgentInvoker=" + useAgentInvoker)
          .add("errorHandler=" + errorHandler)
          .add("idleStrategy=" + idleStrategy)
          .toString();
    }
  }
}
