package jobtrack.gmail.controller;

import jobtrack.gmail.dto.ConnectResponse;
import jobtrack.gmail.dto.ConnectionStatusResponse;
import jobtrack.gmail.dto.DisconnectRequest;
import jobtrack.gmail.dto.DisconnectResponse;
import jobtrack.gmail.exception.GmailSyncException;
import jobtrack.gmail.service.ConnectionService;
import jobtrack.gmail.service.CurrentUserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;

/**
 * Gmail connect, OAuth callback, disconnect and connection status.
 */
@Slf4j
@RestController
@RequestMapping("/api/auth/gmail")
public class GmailConnectionController {
    static final String RETURN_PATH = "/networking";

    private final ConnectionService connectionService;
    private final CurrentUserService currentUserService;

    public GmailConnectionController(ConnectionService connectionService, CurrentUserService currentUserService) {
        this.connectionService = connectionService;
        this.currentUserService = currentUserService;
    }

    @GetMapping("/connect")
    public ConnectResponse connect(Authentication authentication) {
        String userId = currentUserService.requireUserId(authentication);
        return new ConnectResponse(connectionService.connect(userId));
    }

    /**
     * Google redirects the browser here. The outcome is reported back to the UI as a query parameter.
     */
    @GetMapping("/callback")
    public ResponseEntity<Void> callback(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error,
            Authentication authentication) {
        String userId = currentUserService.requireUserId(authentication);

        if (error != null) {
            log.info("Gmail authorization denied for user {}: {}", userId, error);
            return redirect("gmail_error", error);
        }
        try {
            connectionService.handleCallback(userId, code, state);
            return redirect("gmail_connected", "true");
        } catch (GmailSyncException e) {
            log.warn("Gmail callback failed for user {}: {} {}", userId, e.getCode(), e.getMessage());
            return redirect("gmail_error", e.getCode().name().toLowerCase(Locale.ROOT));
        }
    }

    @PostMapping("/disconnect")
    public DisconnectResponse disconnect(@RequestBody DisconnectRequest request, Authentication authentication) {
        String userId = currentUserService.requireUserId(authentication);
        connectionService.disconnect(userId, request.getConnectionId());
        return new DisconnectResponse(true, "Gmail disconnected successfully");
    }

    @GetMapping("/status")
    public ConnectionStatusResponse status(Authentication authentication) {
        String userId = currentUserService.requireUserId(authentication);
        return connectionService.status(userId);
    }

    private ResponseEntity<Void> redirect(String param, String value) {
        String location = UriComponentsBuilder.fromPath(RETURN_PATH)
                .queryParam(param, value)
                .encode()
                .build()
                .toUriString();
        return ResponseEntity.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, location).build();
    }
}
