package jobtrack.gmail.dto;

import lombok.Value;

import java.time.Instant;

@Value
public class AccessToken {
    String value;
    Instant expiry;
}
