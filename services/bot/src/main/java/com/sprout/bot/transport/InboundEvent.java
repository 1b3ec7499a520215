package com.sprout.bot.transport;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * One update received from the messaging platform.
 *
 * @param eventId platform update id, unique per bot
 * @param chatId chat the reply goes to
 * @param userId Telegram id of the sender
 * @param username sender's username without the {@code @}; may be null
 * @param text message text or callback payload
 * @param receivedAt when the transport received it
 */
public record InboundEvent(String eventId, long chatId, long userId, String username, String text, Instant receivedAt) {

    public InboundEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
        text = text == null ? "" : text;
        receivedAt = receivedAt == null ? Instant.now() : receivedAt;
    }

    /** The leading {@code /command} of the text, lower case, without a {@code @botname} suffix; empty if none. */
    public String command() {
        String trimmed = text.strip();
        if (!trimmed.startsWith("/")) {
            return "";
        }
        int end = trimmed.indexOf(' ');
        String command = end < 0 ? trimmed : trimmed.substring(0, end);
        int at = command.indexOf('@');
        return (at < 0 ? command : command.substring(0, at)).toLowerCase(Locale.ROOT);
    }

    /** Text after the command, stripped; the whole text if there is no command. */
    public String arguments() {
        String trimmed = text.strip();
        if (!trimmed.startsWith("/")) {
            return trimmed;
        }
        int end = trimmed.indexOf(' ');
        return end < 0 ? "" : trimmed.substring(end + 1).strip();
    }
}
