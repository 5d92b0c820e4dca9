package jobtrack.gmail.entity;

public enum EmailDirection {
    SENT,
    RECEIVED
}
