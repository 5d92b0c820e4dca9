package jobtrack.gmail.entity;

public enum SyncRunStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
