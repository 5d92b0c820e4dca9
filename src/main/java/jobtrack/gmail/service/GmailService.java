package jobtrack.gmail.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.Profile;
import jobtrack.gmail.dto.MessagePage;
import jobtrack.gmail.dto.MessageRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Gmail API calls through the Google client library. A {@link Gmail} stub is built per call
 * around the caller's token, so no credential is shared between concurrent runs.
 */
@Slf4j
@Service
public class GmailService implements GmailApiService {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "JobTrack Gmail Sync";
    private static final String ME = "me";

    private final NetHttpTransport httpTransport;

    public GmailService(NetHttpTransport googleHttpTransport) {
        this.httpTransport = googleHttpTransport;
    }

    Gmail getGmailService(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
            .setApplicationName(APPLICATION_NAME)
            .build();
    }

    @Override
    public MessagePage listMessages(String accessToken, String query, String pageToken, long maxResults) throws IOException {
        Gmail.Users.Messages.List request = getGmailService(accessToken).users().messages().list(ME)
            .setQ(query)
            .setMaxResults(maxResults);
        if (pageToken != null) {
            request.setPageToken(pageToken);
        }
        ListMessagesResponse response = request.execute();

        List<MessageRef> refs = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message message : response.getMessages()) {
                refs.add(new MessageRef(message.getId(), message.getThreadId()));
            }
        }
        long estimate = response.getResultSizeEstimate() != null ? response.getResultSizeEstimate() : refs.size();
        log.debug("Listed {} message refs (estimate {}), next page: {}", refs.size(), estimate, response.getNextPageToken() != null);
        return new MessagePage(refs, response.getNextPageToken(), estimate);
    }

    @Override
    public Message getMessage(String accessToken, String messageId) throws IOException {
        return getGmailService(accessToken).users().messages().get(ME, messageId)
            .setFormat("full")
            .execute();
    }

    @Override
    public String getProfileEmail(String accessToken) throws IOException {
        Profile profile = getGmailService(accessToken).users().getProfile(ME).execute();
        return profile.getEmailAddress();
    }
}
