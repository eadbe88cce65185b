package io.iamcore.command;

import io.iamcore.AggregateRef;
import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.ErrorKind;
import io.iamcore.Event;
import io.iamcore.EventType;
import io.iamcore.ObjectDetails;
import io.iamcore.PendingEvent;
import io.iamcore.spi.EventLog;
import io.iamcore.spi.MetricsExporter;
import io.iamcore.writemodel.WriteModel;
import io.iamcore.writemodel.WriteModels;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The pipeline every mutating command runs through: hydrate a write model, append the events
 * the command built, then fold exactly those appended events back into the same model.
 *
 * <p>Thread-safe and stateless apart from its collaborators; share one instance.
 *
 * @see WriteModel
 * @see io.iamcore.spi.EventLog
 */
public final class CommandExecutor {
    private static final Logger logger = Logger.getLogger(CommandExecutor.class.getName());

    private final EventLog eventLog;
    private final MetricsExporter metrics;

    public CommandExecutor(EventLog eventLog) {
        this(eventLog, MetricsExporter.NOOP);
    }

    /**
     * @param eventLog the event log
     * @param metrics  metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
     */
    public CommandExecutor(EventLog eventLog, MetricsExporter metrics) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    /**
     * Replays the model's stream into it.
     */
    public <M extends WriteModel> M hydrate(CommandContext context, M model) {
        WriteModels.hydrate(context, eventLog, model);
        int folded = model.foldedEvents();
        runSafely("recordReplayedEvents", () -> metrics.recordReplayedEvents(folded));
        return model;
    }

    /**
     * Starts a pending event on the model's aggregate, edited by the context's user.
     *
     * <p>When the model replayed its full stream, the event expects the model's processed
     * sequence as aggregate head, so a concurrent write in between is rejected on append.
     */
    public PendingEvent.Builder newEvent(CommandContext context, WriteModel model, EventType type) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(model, "model");
        AggregateRef aggregate = model.aggregate();
        String owner = model.resourceOwner() != null ? model.resourceOwner() : context.resourceOwner();
        PendingEvent.Builder builder = PendingEvent.builder(type)
                .aggregate(new AggregateRef(aggregate.type(), aggregate.id(), owner))
                .context(context);
        if (model.query().isFullStream()) {
            builder.expectedSequence(model.processedSequence());
        }
        return builder;
    }

    /**
     * Appends the events atomically and folds the appended batch into {@code model}.
     *
     * @param model  the hydrated write model of the primary aggregate
     * @param events the primary event first, followed by any cascade events
     * @return details of the model after the fold
     */
    public ObjectDetails push(CommandContext context, WriteModel model, List<PendingEvent> events) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be empty");
        }
        context.checkActive();
        List<Event> appended = eventLog.append(context, events);
        model.apply(appended);
        int count = appended.size();
        runSafely("incrementEventsAppended", () -> metrics.incrementEventsAppended(count));
        return details(model);
    }

    public ObjectDetails push(CommandContext context, WriteModel model, PendingEvent event) {
        return push(context, model, List.of(event));
    }

    /**
     * Runs a command body, recording its outcome and duration.
     *
     * @param name    the command name used for metrics and logs
     * @param context the invocation context
     * @param body    the command
     * @return the body's result
     */
    public <T> T run(String name, CommandContext context, Supplier<T> body) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(context, "context");
        long start = System.nanoTime();
        try {
            T result = body.get();
            runSafely("incrementCommandSucceeded", () -> metrics.incrementCommandSucceeded(name));
            return result;
        } catch (CommandException e) {
            if (isNoOp(e)) {
                runSafely("incrementNoOpSuppressed", () -> metrics.incrementNoOpSuppressed(name));
            }
            runSafely("incrementCommandFailed", () -> metrics.incrementCommandFailed(name, e.kind()));
            logger.log(e.isRetryable() ? Level.WARNING : Level.FINE,
                    "Command " + name + " failed for " + context + ": " + e.getMessage());
            throw e;
        } finally {
            long durationMs = Math.max(0L, (System.nanoTime() - start) / 1_000_000L);
            runSafely("recordCommandDurationMs", () -> metrics.recordCommandDurationMs(name, durationMs));
        }
    }

    /**
     * Builds the command result from a write model.
     */
    public static ObjectDetails details(WriteModel model) {
        return new ObjectDetails(
                model.aggregate().id(),
                model.processedSequence(),
                model.changeDate(),
                model.creationDate(),
                model.resourceOwner());
    }

    private static boolean isNoOp(CommandException e) {
        return e.kind() == ErrorKind.PRECONDITION_FAILED && "Errors.NoChangesFound".equals(e.messageKey());
    }

    private void runSafely(String phase, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "MetricsExporter." + phase + " failed", ex);
        }
    }
}
