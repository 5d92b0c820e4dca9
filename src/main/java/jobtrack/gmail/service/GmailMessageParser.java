package jobtrack.gmail.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import jobtrack.gmail.dto.MailMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Turns a {@code full} format Gmail message into a {@link MailMessage}.
 */
@Slf4j
@Component
public class GmailMessageParser {
    private static final String NO_SUBJECT = "(No Subject)";

    public MailMessage parse(Message message) {
        String from = null;
        String to = null;
        String cc = null;
        String subject = null;
        String date = null;

        MessagePart payload = message.getPayload();
        if (payload != null && payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                if (header.getName() == null) {
                    continue;
                }
                String value = header.getValue();
                switch (header.getName().toLowerCase()) {
                    case "from":
                        from = value;
                        break;
                    case "to":
                        to = value;
                        break;
                    case "cc":
                        cc = value;
                        break;
                    case "subject":
                        subject = value;
                        break;
                    case "date":
                        date = value;
                        break;
                    default:
                        break;
                }
            }
        }

        String snippet = message.getSnippet() != null ? message.getSnippet() : "";
        return MailMessage.builder()
            .messageId(message.getId())
            .threadId(message.getThreadId())
            .from(from)
            .to(to)
            .cc(cc)
            .subject(subject == null || subject.isBlank() ? NO_SUBJECT : subject)
            .date(resolveDate(date, message.getInternalDate()))
            .snippet(snippet)
            .body(extractBody(payload, snippet))
            .build();
    }

    /**
     * The {@code Date} header when it parses, otherwise Gmail's internal receive time.
     */
    Instant resolveDate(String dateHeader, Long internalDate) {
        if (dateHeader != null && !dateHeader.isBlank()) {
            // RFC 2822 allows a trailing zone comment such as "(UTC)"
            String cleaned = dateHeader.replaceAll("\\s*\\([^)]*\\)\\s*$", "").trim();
            try {
                return ZonedDateTime.parse(cleaned, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable Date header '{}', falling back to internalDate", dateHeader);
            }
        }
        return internalDate != null ? Instant.ofEpochMilli(internalDate) : null;
    }

    /**
     * Plain text is preferred anywhere in the part tree, then tag-stripped HTML, then the snippet.
     */
    String extractBody(MessagePart payload, String snippet) {
        if (payload == null) {
            return snippet;
        }
        String plain = findPart(payload, "text/plain");
        if (plain != null && !plain.isBlank()) {
            return plain;
        }
        String html = findPart(payload, "text/html");
        if (html != null && !html.isBlank()) {
            return html.replaceAll("<[^>]*>", " ").replaceAll("\\s+", " ").trim();
        }
        return snippet;
    }

    private String findPart(MessagePart part, String mimeType) {
        if (mimeType.equals(part.getMimeType()) && part.getBody() != null && part.getBody().getData() != null) {
            String decoded = decodeBase64Url(part.getBody().getData());
            if (decoded != null) {
                return decoded;
            }
        }
        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                String found = findPart(subPart, mimeType);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private String decodeBase64Url(String data) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Some senders produce standard Base64 without padding
            try {
                String padded = data;
                int remainder = padded.length() % 4;
                if (remainder > 0) {
                    padded += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part: {}", e2.getMessage());
                return null;
            }
        }
    }
}
