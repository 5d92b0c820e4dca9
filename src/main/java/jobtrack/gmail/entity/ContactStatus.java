package jobtrack.gmail.entity;

public enum ContactStatus {
    TO_REACH_OUT,
    CONNECTED,
    FOLLOWING_UP
}
