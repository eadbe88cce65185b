package io.iamcore.codec;

import io.iamcore.CommandException;
import io.iamcore.ErrorKind;
import io.iamcore.EventPayload;
import io.iamcore.ProtectedSecret;
import io.iamcore.smtp.SmtpConfigEvents;
import io.iamcore.user.UserEvents;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonEventCodecTest {
    private final JacksonEventCodec codec = new JacksonEventCodec();

    @Test
    void deltaPayloadOmitsUnchangedFields() {
        String json = codec.encode(new SmtpConfigEvents.Changed(null, null, null, "smtp.example.com", null));

        assertEquals("{\"host\":\"smtp.example.com\"}", json);
    }

    @Test
    void decodesIntoPayloadTypeOfEventType() {
        EventPayload payload = codec.decode(SmtpConfigEvents.SMTP_CONFIG_PASSWORD_CHANGED,
                "{\"password\":{\"algorithm\":\"AES-GCM\",\"keyId\":\"k1\",\"ciphertext\":\"abc\"}}");

        SmtpConfigEvents.PasswordChanged changed = assertInstanceOf(SmtpConfigEvents.PasswordChanged.class, payload);
        assertEquals(new ProtectedSecret("AES-GCM", "k1", "abc"), changed.password());
    }

    @Test
    void ignoresUnknownProperties() {
        EventPayload payload = codec.decode(UserEvents.USERNAME_CHANGED,
                "{\"userName\":\"jane\",\"addedInLaterVersion\":42}");

        assertEquals(new UserEvents.UsernameChanged("jane"), payload);
    }

    @Test
    void missingFieldsDecodeAsNull() {
        UserEvents.EmailChanged changed = (UserEvents.EmailChanged) codec.decode(UserEvents.HUMAN_EMAIL_CHANGED,
                "{\"verified\":true}");

        assertNull(changed.email());
        assertTrue(changed.verified());
    }

    @Test
    void mistypedFieldIsDroppedAndRestKept() {
        UserEvents.HumanAdded added = (UserEvents.HumanAdded) codec.decode(UserEvents.HUMAN_ADDED,
                "{\"userName\":\"jane\",\"email\":\"jane@example.com\",\"emailVerified\":{\"legacy\":true},"
                        + "\"phoneVerified\":true}");

        assertEquals("jane", added.userName());
        assertEquals("jane@example.com", added.email());
        assertFalse(added.emailVerified());
        assertTrue(added.phoneVerified());
    }

    @Test
    void mistypedNestedValueIsDropped() {
        SmtpConfigEvents.PasswordChanged changed = (SmtpConfigEvents.PasswordChanged) codec.decode(
                SmtpConfigEvents.SMTP_CONFIG_PASSWORD_CHANGED, "{\"password\":[1,2,3]}");

        assertNull(changed.password());
    }

    @Test
    void emptyRecordsEncodeAsEmptyObject() {
        assertEquals("{}", codec.encode(new UserEvents.Deactivated()));
        assertEquals(new UserEvents.Deactivated(), codec.decode(UserEvents.USER_DEACTIVATED, "{}"));
    }

    @Test
    void malformedJsonIsSerializationError() {
        CommandException e = assertThrows(CommandException.class,
                () -> codec.decode(UserEvents.USERNAME_CHANGED, "not-json{"));

        assertEquals(ErrorKind.SERIALIZATION_ERROR, e.kind());
        assertFalse(e.isRetryable());
    }

    @Test
    void emptyDataIsSerializationError() {
        CommandException e = assertThrows(CommandException.class,
                () -> codec.decode(UserEvents.USERNAME_CHANGED, ""));

        assertEquals(ErrorKind.SERIALIZATION_ERROR, e.kind());
    }
}
