package jobtrack.gmail.entity;

public enum InteractionType {
    EMAIL,
    INFORMATIONAL_INTERVIEW,
    VIDEO_MEETING,
    IN_PERSON_MEETING,
    COFFEE_CHAT,
    EVENT_CONFERENCE
}
