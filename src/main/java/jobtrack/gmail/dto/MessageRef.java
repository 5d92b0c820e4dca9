package jobtrack.gmail.dto;

import lombok.Value;

@Value
public class MessageRef {
    String id;
    String threadId;
}
