package jobtrack.gmail.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * The parts of a Gmail message the entity resolver works with. Address headers are kept raw.
 */
@Value
@Builder
public class MailMessage {
    String messageId;
    String threadId;
    String from;
    String to;
    String cc;
    String subject;
    Instant date;
    String snippet;
    String body;
}
