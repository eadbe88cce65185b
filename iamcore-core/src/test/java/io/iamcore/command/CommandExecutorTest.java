package io.iamcore.command;

import io.iamcore.AggregateRef;
import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.ErrorKind;
import io.iamcore.Event;
import io.iamcore.EventType;
import io.iamcore.IamAggregates;
import io.iamcore.ObjectDetails;
import io.iamcore.PendingEvent;
import io.iamcore.log.InMemoryEventLog;
import io.iamcore.spi.MetricsExporter;
import io.iamcore.user.UserEvents;
import io.iamcore.writemodel.WriteModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandExecutorTest {
    private final InMemoryEventLog log = new InMemoryEventLog();
    private final RecordingMetrics metrics = new RecordingMetrics();
    private final CommandExecutor executor = new CommandExecutor(log, metrics);
    private final CommandContext context = CommandContext.builder()
            .editorUser("admin")
            .instanceId("instance-1")
            .resourceOwner("org-1")
            .build();

    @Test
    void newEventExpectsProcessedSequenceOfFullStreamModel() {
        log.append(context, List.of(renamed("u1", "a")));
        Names model = executor.hydrate(context, new Names("u1", List.of()));

        PendingEvent event = executor.newEvent(context, model, UserEvents.USERNAME_CHANGED)
                .payload(new UserEvents.UsernameChanged("b"))
                .build();

        assertEquals(1, event.expectedSequence());
        assertEquals("admin", event.editorUser());
        assertEquals("org-1", event.aggregate().resourceOwner());
    }

    @Test
    void newEventOfFilteredModelHasNoExpectation() {
        Names model = executor.hydrate(context, new Names("u1", List.of(UserEvents.USERNAME_CHANGED)));

        PendingEvent event = executor.newEvent(context, model, UserEvents.USERNAME_CHANGED)
                .payload(new UserEvents.UsernameChanged("b"))
                .build();

        assertFalse(event.hasExpectedSequence());
    }

    @Test
    void pushFoldsAppendedEventsIntoModel() {
        Names model = executor.hydrate(context, new Names("u1", List.of()));

        ObjectDetails details = executor.push(context, model, executor.newEvent(context, model, UserEvents.USERNAME_CHANGED)
                .payload(new UserEvents.UsernameChanged("a"))
                .build());

        assertEquals(List.of("a"), model.names);
        assertEquals(1, details.sequence());
        assertEquals("1", details.version());
        assertEquals("u1", details.id());
        assertEquals("org-1", details.resourceOwner());
        assertEquals(details.eventDate(), details.creationDate());
        assertEquals(1, metrics.appended);
    }

    @Test
    void staleModelFailsWithConcurrencyConflict() {
        Names stale = executor.hydrate(context, new Names("u1", List.of()));
        PendingEvent late = executor.newEvent(context, stale, UserEvents.USERNAME_CHANGED)
                .payload(new UserEvents.UsernameChanged("late"))
                .build();
        log.append(context, List.of(renamed("u1", "first")));

        CommandException e = assertThrows(CommandException.class, () -> executor.push(context, stale, late));

        assertEquals(ErrorKind.CONCURRENCY_CONFLICT, e.kind());
        assertEquals(0, stale.processedSequence());
        assertEquals(1, log.size());
    }

    @Test
    void pushRejectsEmptyBatch() {
        Names model = new Names("u1", List.of());

        assertThrows(IllegalArgumentException.class, () -> executor.push(context, model, List.of()));
    }

    @Test
    void runRecordsSuccessAndDuration() {
        String result = executor.run("test.ok", context, () -> "done");

        assertEquals("done", result);
        assertEquals(List.of("test.ok"), metrics.succeeded);
        assertEquals(List.of("test.ok"), metrics.timed);
    }

    @Test
    void runRecordsFailureKindAndNoOps() {
        assertThrows(CommandException.class, () -> executor.run("test.noop", context, () -> {
            throw CommandException.noChanges("TEST-NO-CHANGES");
        }));
        assertThrows(CommandException.class, () -> executor.run("test.missing", context, () -> {
            throw CommandException.notFound("TEST-NOT-FOUND", "Errors.NotFound");
        }));

        assertEquals(List.of("test.noop:PRECONDITION_FAILED", "test.missing:NOT_FOUND"), metrics.failed);
        assertEquals(List.of("test.noop"), metrics.noOps);
        assertTrue(metrics.succeeded.isEmpty());
    }

    @Test
    void failingMetricsDoNotFailCommand() {
        CommandExecutor withBrokenMetrics = new CommandExecutor(log, new MetricsExporter() {
            @Override
            public void incrementCommandSucceeded(String command) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void incrementCommandFailed(String command, ErrorKind kind) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void incrementEventsAppended(int count) {
                throw new IllegalStateException("boom");
            }
        });

        assertEquals("ok", withBrokenMetrics.run("test", context, () -> "ok"));
    }

    private PendingEvent renamed(String userId, String name) {
        return PendingEvent.builder(UserEvents.USERNAME_CHANGED)
                .aggregate(AggregateRef.of(IamAggregates.USER, userId, "org-1"))
                .payload(new UserEvents.UsernameChanged(name))
                .build();
    }

    private static final class Names extends WriteModel {
        private final List<String> names = new ArrayList<>();
        private final List<EventType> eventTypes;

        Names(String userId, List<EventType> eventTypes) {
            super(AggregateRef.of(IamAggregates.USER, userId, null));
            this.eventTypes = eventTypes;
        }

        @Override
        protected List<EventType> eventTypes() {
            return eventTypes;
        }

        @Override
        protected void reduce(Event event) {
            if (event.type() == UserEvents.USERNAME_CHANGED) {
                names.add(event.payload(UserEvents.UsernameChanged.class).userName());
            }
        }
    }

    private static final class RecordingMetrics implements MetricsExporter {
        final List<String> succeeded = new ArrayList<>();
        final List<String> failed = new ArrayList<>();
        final List<String> noOps = new ArrayList<>();
        final List<String> timed = new ArrayList<>();
        int appended;

        @Override
        public void incrementCommandSucceeded(String command) {
            succeeded.add(command);
        }

        @Override
        public void incrementCommandFailed(String command, ErrorKind kind) {
            failed.add(command + ":" + kind);
        }

        @Override
        public void incrementEventsAppended(int count) {
            appended += count;
        }

        @Override
        public void incrementNoOpSuppressed(String command) {
            noOps.add(command);
        }

        @Override
        public void recordCommandDurationMs(String command, long durationMs) {
            timed.add(command);
        }
    }
}
