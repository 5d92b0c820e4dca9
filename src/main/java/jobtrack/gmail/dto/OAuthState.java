package jobtrack.gmail.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload signed into the OAuth {@code state} parameter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OAuthState {
    private String userId;
    private long issuedAt;
    private String nonce;
}
