package io.iamcore.micrometer;

import io.iamcore.ErrorKind;
import io.iamcore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a distribution summary and a timer with a {@link MeterRegistry} for
 * export to Prometheus, Grafana, Datadog, and other monitoring backends. Per-command meters
 * are tagged with {@code command} and created on first use.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code iamcore.command.success} (tag {@code command}): commands that appended events</li>
 *   <li>{@code iamcore.command.failure} (tags {@code command}, {@code kind}): failed commands</li>
 *   <li>{@code iamcore.command.noop} (tag {@code command}): commands rejected as no-ops</li>
 *   <li>{@code iamcore.events.appended}: events written to the log</li>
 * </ul>
 *
 * <h3>Distributions</h3>
 * <ul>
 *   <li>{@code iamcore.replay.events}: events folded per write-model hydration</li>
 *   <li>{@code iamcore.command.duration} (tag {@code command}): command wall time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter eventsAppended;
  private final DistributionSummary replayedEvents;
  private final Map<String, Meter> commandMeters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "iamcore"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "iamcore");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "tenant.iamcore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.eventsAppended = Counter.builder(namePrefix + ".events.appended")
        .description("Events appended to the event log")
        .register(registry);
    this.replayedEvents = DistributionSummary.builder(namePrefix + ".replay.events")
        .description("Events folded per write model hydration")
        .register(registry);
  }

  @Override
  public void incrementCommandSucceeded(String command) {
    if (closed) return;
    counter("command.success", "Commands that appended events", command, null).increment();
  }

  @Override
  public void incrementCommandFailed(String command, ErrorKind kind) {
    if (closed) return;
    counter("command.failure", "Commands that failed", command, kind).increment();
  }

  @Override
  public void incrementEventsAppended(int count) {
    if (closed) return;
    eventsAppended.increment(count);
  }

  @Override
  public void incrementNoOpSuppressed(String command) {
    if (closed) return;
    counter("command.noop", "Commands rejected because nothing changed", command, null).increment();
  }

  @Override
  public void recordReplayedEvents(int count) {
    if (closed) return;
    replayedEvents.record(count);
  }

  @Override
  public void recordCommandDurationMs(String command, long durationMs) {
    if (closed) return;
    Timer timer = (Timer) commandMeters.computeIfAbsent("command.duration|" + command,
        key -> Timer.builder(namePrefix + ".command.duration")
            .description("Command wall time")
            .tag("command", command)
            .register(registry));
    timer.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(commandMeters.values());
    meters.add(eventsAppended);
    meters.add(replayedEvents);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    commandMeters.clear();
    if (first != null) throw first;
  }

  private Counter counter(String name, String description, String command, ErrorKind kind) {
    String key = name + "|" + command + (kind == null ? "" : "|" + kind);
    return (Counter) commandMeters.computeIfAbsent(key, k -> {
      Counter.Builder builder = Counter.builder(namePrefix + "." + name)
          .description(description)
          .tag("command", command);
      if (kind != null) {
        builder.tag("kind", kind.name().toLowerCase(Locale.ROOT));
      }
      return builder.register(registry);
    });
  }
}
