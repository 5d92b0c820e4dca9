package jobtrack.gmail.controller;

import jobtrack.gmail.dto.SyncRequest;
import jobtrack.gmail.dto.SyncResult;
import jobtrack.gmail.dto.SyncStatusResponse;
import jobtrack.gmail.service.CurrentUserService;
import jobtrack.gmail.service.GmailSyncService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/gmail/sync")
public class GmailSyncController {
    private final GmailSyncService gmailSyncService;
    private final CurrentUserService currentUserService;

    public GmailSyncController(GmailSyncService gmailSyncService, CurrentUserService currentUserService) {
        this.gmailSyncService = gmailSyncService;
        this.currentUserService = currentUserService;
    }

    /**
     * Runs a sync and returns its result, or with {@code async} returns 202 and the claimed run.
     * A failed run is still a 200: the outcome is in the body.
     */
    @PostMapping
    public ResponseEntity<?> sync(@RequestBody SyncRequest request, Authentication authentication) {
        String userId = currentUserService.requireUserId(authentication);
        if (request.isAsync()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(gmailSyncService.startAsync(userId, request));
        }
        SyncResult result = gmailSyncService.sync(userId, request);
        return ResponseEntity.ok(result);
    }

    @GetMapping
    public SyncStatusResponse status(@RequestParam String connectionId, Authentication authentication) {
        String userId = currentUserService.requireUserId(authentication);
        return gmailSyncService.status(userId, connectionId);
    }
}
