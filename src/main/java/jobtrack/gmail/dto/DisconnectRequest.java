package jobtrack.gmail.dto;

import lombok.Data;

@Data
public class DisconnectRequest {
    private String connectionId;
}
