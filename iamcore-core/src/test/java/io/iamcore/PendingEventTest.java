package io.iamcore;

import io.iamcore.smtp.SmtpConfigEvents;
import io.iamcore.user.UserEvents;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PendingEventTest {
    private static final AggregateRef INSTANCE = AggregateRef.of(IamAggregates.INSTANCE, "instance-1", "instance-1");

    @Test
    void builderAssignsUlidAndNoExpectation() {
        PendingEvent event = PendingEvent.builder(SmtpConfigEvents.SMTP_CONFIG_REMOVED)
                .aggregate(INSTANCE)
                .payload(new SmtpConfigEvents.Removed())
                .editorUser("admin")
                .build();

        assertEquals(26, event.eventId().length()); // ULID format
        assertFalse(event.hasExpectedSequence());
        assertEquals(PendingEvent.ANY_SEQUENCE, event.expectedSequence());
        assertEquals("admin", event.editorUser());
    }

    @Test
    void eventIdsAreUnique() {
        PendingEvent first = removed();
        PendingEvent second = removed();

        assertNotEquals(first.eventId(), second.eventId());
    }

    @Test
    void expectedSequenceIsKept() {
        PendingEvent event = PendingEvent.builder(SmtpConfigEvents.SMTP_CONFIG_REMOVED)
                .aggregate(INSTANCE)
                .payload(new SmtpConfigEvents.Removed())
                .expectedSequence(0)
                .build();

        assertTrue(event.hasExpectedSequence());
        assertEquals(0, event.expectedSequence());
    }

    @Test
    void rejectsPayloadOfAnotherType() {
        assertThrows(IllegalArgumentException.class, () -> PendingEvent.builder(SmtpConfigEvents.SMTP_CONFIG_REMOVED)
                .aggregate(INSTANCE)
                .payload(new SmtpConfigEvents.PasswordChanged(null))
                .build());
    }

    @Test
    void rejectsAggregateOfAnotherType() {
        AggregateRef user = AggregateRef.of(IamAggregates.USER, "user-1", "org-1");

        assertThrows(IllegalArgumentException.class, () -> PendingEvent.builder(SmtpConfigEvents.SMTP_CONFIG_REMOVED)
                .aggregate(user)
                .payload(new SmtpConfigEvents.Removed())
                .build());
    }

    @Test
    void requiresAggregateAndPayload() {
        assertThrows(NullPointerException.class, () -> PendingEvent.builder(UserEvents.USER_DEACTIVATED)
                .payload(new UserEvents.Deactivated())
                .build());
        assertThrows(NullPointerException.class, () -> PendingEvent.builder(UserEvents.USER_DEACTIVATED)
                .aggregate(AggregateRef.of(IamAggregates.USER, "user-1", "org-1"))
                .build());
    }

    @Test
    void aggregateRefComparesStreamsWithoutOwner() {
        AggregateRef a = new AggregateRef("USER", "u1", "org-1");
        AggregateRef b = new AggregateRef("USER", "u1", null);

        assertTrue(a.sameStream(b));
        assertFalse(a.sameStream(new AggregateRef("ORG", "u1", "org-1")));
        assertEquals("USER/u1", a.toString());
    }

    private static PendingEvent removed() {
        return PendingEvent.builder(SmtpConfigEvents.SMTP_CONFIG_REMOVED)
                .aggregate(INSTANCE)
                .payload(new SmtpConfigEvents.Removed())
                .build();
    }
}
