package jobtrack.gmail.dto;

import lombok.Value;

@Value
public class ConnectResponse {
    String authUrl;
}
