package io.scalecube.graphite.publisher;

import static java.nio.charset.StandardCharsets.UTF_8;

import io.scalecube.graphite.metrics.Metric;
import io.scalecube.graphite.metrics.MetricVisitor;
import io.scalecube.graphite.metrics.MetricsSource;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.net.SocketFactory;
import org.agrona.CloseHelper;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs one flush cycle: connects to Graphite, serializes every metric of the {@link
 * MetricsSource} with {@link GraphiteSerializer}, writes the lines, and closes the connection.
 * Output is flushed after each metric. Instances are reusable, each {@link #flush()} call opens its
 * own connection, which makes them suitable as a building block for custom retry policies.
 *
 * @see GraphitePublisher
 */
public class GraphiteFlusher {

  private static final Logger LOGGER = LoggerFactory.getLogger(GraphiteFlusher.class);

  private final InetSocketAddress address;
  private final MetricsSource metricsSource;
  private final EpochClock epochClock;
  private final SocketFactory socketFactory;
  private final int connectTimeoutMillis;
  private final GraphiteSerializer serializer;

  /**
   * Constructor.
   *
   * @param address graphite address
   * @param metricsSource metrics to be published
   * @param epochClock clock for line timestamps
   * @param socketFactory factory of (unconnected) sockets
   * @param connectTimeout connect timeout, zero means infinite
   * @param serializer serializer
   */
  public GraphiteFlusher(
      InetSocketAddress address,
      MetricsSource metricsSource,
      EpochClock epochClock,
      SocketFactory socketFactory,
      Duration connectTimeout,
      GraphiteSerializer serializer) {
    this.address = address;
    this.metricsSource = metricsSource;
    this.epochClock = epochClock;
    this.socketFactory = socketFactory;
    this.connectTimeoutMillis = (int) Math.min(connectTimeout.toMillis(), Integer.MAX_VALUE);
    this.serializer = serializer;
  }

  public InetSocketAddress address() {
    return address;
  }

  /**
   * Publishes all metrics over a new connection. Failures to write particular metrics are logged
   * and do not stop the cycle.
   *
   * @return number of lines written and flushed
   * @throws IOException if connection could not be established
   */
  public int flush() throws IOException {
    final var timestamp = TimeUnit.MILLISECONDS.toSeconds(epochClock.time());

    try (var socket = connect()) {
      final var writer =
          new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), UTF_8));
      final var cycle = new FlushCycle(writer, timestamp);

      metricsSource.forEach(cycle);

      if (cycle.failed > 0) {
        LOGGER.warn(
            "Failed to write {} metric(s) to {}, last error: {}",
            cycle.failed,
            address,
            String.valueOf(cycle.lastError));
      }
      return cycle.written;
    }
  }

  private Socket connect() throws IOException {
    final var socket = socketFactory.createSocket();
    try {
      socket.connect(address, connectTimeoutMillis);
    } catch (IOException e) {
      CloseHelper.quietClose(socket);
      throw e;
    }
    return socket;
  }

  private class FlushCycle implements MetricVisitor {

    private final Writer writer;
    private final long timestamp;

    private int written;
    private int failed;
    private IOException lastError;

    private FlushCycle(Writer writer, long timestamp) {
      this.writer = writer;
      this.timestamp = timestamp;
    }

    @Override
    public void visit(String name, Metric metric) {
      final var lines = serializer.format(name, metric, timestamp);
      if (lines.isEmpty()) {
        return;
      }
      try {
        for (var line : lines) {
          writer.write(line);
          writer.write('\n');
        }
        writer.flush();
        written += lines.size();
      } catch (IOException e) {
        failed++;
        lastError = e;
        LOGGER.debug("Failed to write metric {} to {}", name, address, e);
      }
    }
  }
}
