package jobtrack.gmail.dto;

import jobtrack.gmail.entity.SyncType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sync trigger input. Null {@code daysSince}/{@code maxEmails} fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {
    private String connectionId;
    private Integer daysSince;
    private Integer maxEmails;
    private SyncType syncType;
    private boolean async;

    public SyncRequest(String connectionId, Integer daysSince, Integer maxEmails) {
        this(connectionId, daysSince, maxEmails, SyncType.MANUAL, false);
    }
}
