package jobtrack.gmail.dto;

import lombok.Value;

@Value
public class ResolutionOutcome {
    boolean companyCreated;
    boolean contactCreated;
    boolean interactionCreated;
}
