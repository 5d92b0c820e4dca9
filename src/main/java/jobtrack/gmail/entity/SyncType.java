package jobtrack.gmail.entity;

public enum SyncType {
    MANUAL,
    AUTOMATIC,
    INITIAL
}
