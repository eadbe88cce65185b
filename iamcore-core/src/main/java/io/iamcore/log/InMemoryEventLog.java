package io.iamcore.log;

import io.iamcore.AggregateRef;
import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.Event;
import io.iamcore.PendingEvent;
import io.iamcore.spi.EventLog;
import io.iamcore.spi.ReplayQuery;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventLog} kept in memory, for tests and embedded use.
 *
 * <p>Appends are serialized by one lock. Each batch is validated in full before anything is
 * stored, so a rejected batch leaves the log untouched.
 */
public final class InMemoryEventLog implements EventLog {
    private static final Logger logger = Logger.getLogger(InMemoryEventLog.class.getName());

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<Event>> streams = new LinkedHashMap<>();

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    public InMemoryEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<Event> append(CommandContext context, List<PendingEvent> events) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return List.of();
        }
        context.checkActive();
        lock.lock();
        try {
            Map<String, Long> heads = new HashMap<>();
            for (PendingEvent pending : events) {
                String key = key(pending.aggregate());
                long head = heads.computeIfAbsent(key, this::headOf);
                if (pending.hasExpectedSequence() && pending.expectedSequence() != head) {
                    throw CommandException.concurrencyConflict(
                            pending.aggregate().toString(), pending.expectedSequence(), head);
                }
                heads.put(key, head + 1);
            }

            List<Event> appended = new ArrayList<>(events.size());
            for (PendingEvent pending : events) {
                List<Event> stream = streams.computeIfAbsent(key(pending.aggregate()), k -> new ArrayList<>());
                AggregateRef aggregate = ownerOf(stream, pending.aggregate());
                Event event = new Event(
                        pending.eventId(),
                        aggregate,
                        stream.size() + 1L,
                        pending.type(),
                        pending.payload(),
                        pending.editorUser(),
                        clock.instant());
                stream.add(event);
                appended.add(event);
            }
            logger.log(Level.FINE, "Appended {0} event(s)", appended.size());
            return List.copyOf(appended);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> replay(CommandContext context, ReplayQuery query) {
        Objects.requireNonNull(query, "query");
        context.checkActive();
        lock.lock();
        try {
            List<Event> stream = streams.get(query.aggregateType() + "/" + query.aggregateId());
            if (stream == null) {
                return List.of();
            }
            List<Event> result = new ArrayList<>();
            for (Event event : stream) {
                if (query.resourceOwner() != null
                        && !query.resourceOwner().equals(event.aggregate().resourceOwner())) {
                    continue;
                }
                if (query.matches(event.type().name(), event.sequence())) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> aggregateIds(CommandContext context, String aggregateType, String resourceOwner) {
        Objects.requireNonNull(aggregateType, "aggregateType");
        context.checkActive();
        lock.lock();
        try {
            List<String> ids = new ArrayList<>();
            for (List<Event> stream : streams.values()) {
                AggregateRef aggregate = stream.get(0).aggregate();
                if (aggregate.type().equals(aggregateType)
                        && (resourceOwner == null || resourceOwner.equals(aggregate.resourceOwner()))) {
                    ids.add(aggregate.id());
                }
            }
            return ids;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the total number of stored events.
     */
    public int size() {
        lock.lock();
        try {
            int size = 0;
            for (List<Event> stream : streams.values()) {
                size += stream.size();
            }
            return size;
        } finally {
            lock.unlock();
        }
    }

    private long headOf(String key) {
        List<Event> stream = streams.get(key);
        return stream == null ? 0L : stream.size();
    }

    // The first event fixes the owner of a stream.
    private static AggregateRef ownerOf(List<Event> stream, AggregateRef requested) {
        if (stream.isEmpty()) {
            return requested;
        }
        return new AggregateRef(requested.type(), requested.id(), stream.get(0).aggregate().resourceOwner());
    }

    private static String key(AggregateRef aggregate) {
        return aggregate.type() + "/" + aggregate.id();
    }
}
