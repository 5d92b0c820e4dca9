package jobtrack.gmail.dto;

import lombok.Value;

import java.util.List;

/**
 * One page of a message listing. {@code nextPageToken} is null at the end of the list.
 */
@Value
public class MessagePage {
    List<MessageRef> messages;
    String nextPageToken;
    long resultSizeEstimate;

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
