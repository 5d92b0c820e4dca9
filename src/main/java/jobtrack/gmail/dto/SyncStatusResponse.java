package jobtrack.gmail.dto;

import jobtrack.gmail.entity.SyncRun;
import lombok.Value;

import java.util.List;

@Value
public class SyncStatusResponse {
    boolean inProgress;
    /** Newest first. */
    List<SyncRun> recentRuns;
}
