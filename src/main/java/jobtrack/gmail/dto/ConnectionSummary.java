package jobtrack.gmail.dto;

import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.entity.SyncRun;
import lombok.Value;

import java.time.Instant;

/**
 * A connection as shown to its owner. Tokens are never part of it.
 */
@Value
public class ConnectionSummary {
    String id;
    String emailAddress;
    boolean active;
    Instant lastSyncAt;
    Instant createdAt;
    SyncRun lastSync;

    public static ConnectionSummary of(GmailConnection connection, SyncRun lastSync) {
        return new ConnectionSummary(connection.getId(), connection.getEmailAddress(), connection.isActive(),
                connection.getLastSyncAt(), connection.getCreatedAt(), lastSync);
    }
}
