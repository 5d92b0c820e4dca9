package jobtrack.gmail.service;

import com.google.api.services.gmail.model.Message;
import jobtrack.gmail.dto.MessagePage;

import java.io.IOException;

/**
 * Raw Gmail API operations for an already valid access token.
 * Token freshness, 401 handling and retries live in {@link GmailMailClient}.
 */
public interface GmailApiService {
    /**
     * List message refs of the authorized mailbox.
     * @param accessToken OAuth access token
     * @param query Gmail search query, e.g. {@code after:1700000000}
     * @param pageToken token from the previous page, null for the first page
     * @param maxResults page size
     * @return one page of refs; an empty list when nothing matches
     * @throws IOException on transport failure or an error response
     */
    MessagePage listMessages(String accessToken, String query, String pageToken, long maxResults) throws IOException;

    /**
     * Fetch a single message in {@code full} format.
     */
    Message getMessage(String accessToken, String messageId) throws IOException;

    /**
     * The mailbox's own address.
     */
    String getProfileEmail(String accessToken) throws IOException;
}
