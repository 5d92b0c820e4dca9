package jobtrack.gmail.dto;

import lombok.Value;

@Value
public class DisconnectResponse {
    boolean success;
    String message;
}
