package io.iamcore;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandContextTest {

    @Test
    void resourceOwnerDefaultsToInstance() {
        CommandContext context = CommandContext.of("admin", "instance-1");

        assertEquals("instance-1", context.resourceOwner());
        assertNull(context.deadline());
        assertFalse(context.isCancelled());
    }

    @Test
    void cancelFailsCheckActive() {
        CommandContext context = CommandContext.of("admin", "instance-1");
        context.cancel();

        CommandException e = assertThrows(CommandException.class, context::checkActive);
        assertEquals(ErrorKind.CANCELLED, e.kind());
        assertFalse(e.isRetryable());
    }

    @Test
    void passedDeadlineCancels() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);

        CommandContext expired = CommandContext.builder()
                .editorUser("admin")
                .instanceId("instance-1")
                .deadline(now)
                .clock(clock)
                .build();
        CommandContext pending = CommandContext.builder()
                .editorUser("admin")
                .instanceId("instance-1")
                .deadline(now.plusSeconds(1))
                .clock(clock)
                .build();

        assertTrue(expired.isCancelled());
        assertThrows(CommandException.class, expired::checkActive);
        assertDoesNotThrow(pending::checkActive);
    }

    @Test
    void withResourceOwnerKeepsIdentity() {
        CommandContext context = CommandContext.of("admin", "instance-1").withResourceOwner("org-1");

        assertEquals("admin", context.editorUser());
        assertEquals("instance-1", context.instanceId());
        assertEquals("org-1", context.resourceOwner());
    }

    @Test
    void requiresEditorAndInstance() {
        assertThrows(NullPointerException.class, () -> CommandContext.builder().instanceId("i").build());
        assertThrows(NullPointerException.class, () -> CommandContext.builder().editorUser("u").build());
    }

    @Test
    void onlyConflictsAndOutagesAreRetryable() {
        for (ErrorKind kind : ErrorKind.values()) {
            boolean expected = kind == ErrorKind.CONCURRENCY_CONFLICT || kind == ErrorKind.UNAVAILABLE;
            assertEquals(expected, kind.isRetryable(), kind.name());
        }
    }
}
