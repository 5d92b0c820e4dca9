package jobtrack.gmail.dto;

import lombok.Value;

import java.util.List;

@Value
public class ConnectionStatusResponse {
    boolean connected;
    List<ConnectionSummary> connections;
}
