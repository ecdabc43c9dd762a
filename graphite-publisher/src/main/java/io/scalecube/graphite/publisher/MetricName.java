package io.scalecube.graphite.publisher;

/**
 * Metric name split into plain name and graphite tag suffix.
 *
 * @param name name to be used as dotted path component
 * @param tags tag suffix including leading semicolon (e.g. {@code ;dc=dc1;rack=a1}), or empty
 *     string
 * @see <a href="https://graphite.readthedocs.io/en/latest/tags.html">Graphite tags</a>
 */
public record MetricName(String name, String tags) {

  private static final char TAGS_SEPARATOR = ';';

  /**
   * Splits raw metric name at the first semicolon. Everything after it is kept verbatim as tag
   * suffix.
   *
   * <ul>
   *   <li>{@code disk.used} -> ({@code disk.used}, "")
   *   <li>{@code disk.used;dc=dc1;rack=a1} -> ({@code disk.used}, {@code ;dc=dc1;rack=a1})
   * </ul>
   *
   * @param value raw metric name
   * @return {@code MetricName} instance
   */
  public static MetricName parse(String value) {
    final var index = value.indexOf(TAGS_SEPARATOR);
    if (index < 0) {
      return new MetricName(value, "");
    }
    return new MetricName(value.substring(0, index), value.substring(index));
  }
}
