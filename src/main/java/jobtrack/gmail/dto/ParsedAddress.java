package jobtrack.gmail.dto;

import lombok.Value;

@Value
public class ParsedAddress {
    /** Lower-cased address. */
    String email;
    /** Display name, empty when the header carried none. */
    String name;
    String domain;

    public String getLocalPart() {
        return email.substring(0, email.indexOf('@'));
    }
}
