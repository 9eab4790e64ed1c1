package mailbox.jobs.app.mailbox;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.MailItemState;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.MessagePage;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link MailboxClient} backed by the Gmail REST API. Folders are Gmail labels, addressed by name;
 * uids are Gmail message ids.
 */
@Slf4j
public class GmailMailboxClient implements MailboxClient {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Mailbox Job Engine";
    private static final String UNREAD = "UNREAD";
    private static final List<String> METADATA_HEADERS =
        List.of("From", "To", "Cc", "Subject", "Message-ID");

    private final Gmail gmail;
    private final String userId;
    private final String archiveFolder;

    // label name -> id, loaded lazily and extended when labels are created
    private final Map<String, String> labelIds = new HashMap<>();
    private final Map<String, String> labelNames = new HashMap<>();
    private boolean labelsLoaded;

    public GmailMailboxClient(Gmail gmail, String userId, String archiveFolder) {
        this.gmail = gmail;
        this.userId = userId;
        this.archiveFolder = archiveFolder;
    }

    public static Gmail connect(NetHttpTransport httpTransport, String accessToken) {
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
    public MessagePage listMessages(String folder, String pageToken, int pageSize) throws IOException {
        String folderLabel = requireLabelId(folder);
        ListMessagesResponse response = gmail.users().messages().list(userId)
            .setLabelIds(List.of(folderLabel))
            .setPageToken(pageToken)
            .setMaxResults((long) pageSize)
            .execute();

        List<MailMessage> messages = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message messageRef : response.getMessages()) {
                try {
                    Message message = gmail.users().messages().get(userId, messageRef.getId())
                        .setFormat("metadata")
                        .setMetadataHeaders(METADATA_HEADERS)
                        .execute();
                    messages.add(toMailMessage(message, folder));
                } catch (GoogleJsonResponseException e) {
                    if (e.getStatusCode() != 404) {
                        throw e;
                    }
                    // deleted between list and get
                    log.debug("Message {} vanished while listing {}", messageRef.getId(), folder);
                }
            }
        }
        return new MessagePage(messages, response.getNextPageToken());
    }

    @Override
    public MailItemState fetchState(MailItemRef item) throws IOException {
        Message message = execute(item, () -> gmail.users().messages().get(userId, item.getUid())
            .setFormat("minimal")
            .execute());
        List<String> ids = message.getLabelIds() == null ? List.of() : message.getLabelIds();
        if (!isArchive(item.getFolder()) && !ids.contains(requireLabelId(item.getFolder()))) {
            throw new MailboxConflictException(
                "Message " + item.getUid() + " is no longer in " + item.getFolder());
        }
        return new MailItemState(item.getFolder(), ids.contains(UNREAD), resolveNames(ids));
    }

    @Override
    public void markRead(MailItemRef item) throws IOException {
        modify(item, List.of(), List.of(UNREAD));
    }

    @Override
    public void markUnread(MailItemRef item) throws IOException {
        modify(item, List.of(UNREAD), List.of());
    }

    @Override
    public void move(MailItemRef item, String destination) throws IOException {
        List<String> remove = isArchive(item.getFolder()) ? List.of() : List.of(requireLabelId(item.getFolder()));
        List<String> add = isArchive(destination) ? List.of() : List.of(labelIdCreatingIfMissing(destination));
        modify(item, add, remove);
    }

    @Override
    public void addLabels(MailItemRef item, List<String> labels) throws IOException {
        List<String> ids = new ArrayList<>();
        for (String label : labels) {
            ids.add(labelIdCreatingIfMissing(label));
        }
        modify(item, ids, List.of());
    }

    @Override
    public void removeLabels(MailItemRef item, List<String> labels) throws IOException {
        List<String> ids = new ArrayList<>();
        for (String label : labels) {
            String id = labelId(label);
            if (id != null) {
                ids.add(id);
            }
        }
        if (!ids.isEmpty()) {
            modify(item, List.of(), ids);
        }
    }

    private void modify(MailItemRef item, List<String> add, List<String> remove) throws IOException {
        ModifyMessageRequest request = new ModifyMessageRequest()
            .setAddLabelIds(add)
            .setRemoveLabelIds(remove);
        execute(item, () -> gmail.users().messages().modify(userId, item.getUid(), request).execute());
    }

    private <T> T execute(MailItemRef item, GmailCall<T> call) throws IOException {
        try {
            return call.execute();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 404 || e.getStatusCode() == 409) {
                throw new MailboxConflictException(
                    "Message " + item.getUid() + " in " + item.getFolder() + " changed remotely: "
                        + e.getStatusMessage(), e);
            }
            throw e;
        }
    }

    private MailMessage toMailMessage(Message message, String folder) throws IOException {
        Map<String, String> headers = new HashMap<>();
        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                headers.put(header.getName().toLowerCase(), header.getValue());
            }
        }
        List<String> ids = message.getLabelIds() == null ? List.of() : message.getLabelIds();
        return MailMessage.builder()
            .uid(message.getId())
            .folder(folder)
            .messageId(headers.get("message-id"))
            .fromAddr(headers.getOrDefault("from", ""))
            .toAddr(headers.getOrDefault("to", ""))
            .ccAddr(headers.getOrDefault("cc", ""))
            .subject(headers.getOrDefault("subject", ""))
            .date(message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : null)
            .bodyText(message.getSnippet() != null ? message.getSnippet() : "")
            .unread(ids.contains(UNREAD))
            .labels(resolveNames(ids))
            .build();
    }

    private boolean isArchive(String folder) {
        return archiveFolder.equals(folder);
    }

    private synchronized String labelId(String name) throws IOException {
        loadLabels();
        return labelIds.get(name);
    }

    private String requireLabelId(String name) throws IOException {
        String id = labelId(name);
        if (id == null) {
            throw new MailboxConflictException("Folder not found: " + name);
        }
        return id;
    }

    private synchronized String labelIdCreatingIfMissing(String name) throws IOException {
        String existing = labelId(name);
        if (existing != null) {
            return existing;
        }
        Label created = gmail.users().labels().create(userId, new Label()
                .setName(name)
                .setLabelListVisibility("labelShow")
                .setMessageListVisibility("show"))
            .execute();
        log.info("Created Gmail label {} ({})", name, created.getId());
        labelIds.put(name, created.getId());
        labelNames.put(created.getId(), name);
        return created.getId();
    }

    private synchronized List<String> resolveNames(List<String> ids) throws IOException {
        loadLabels();
        List<String> names = new ArrayList<>();
        for (String id : ids) {
            names.add(labelNames.getOrDefault(id, id));
        }
        return names;
    }

    private synchronized void loadLabels() throws IOException {
        if (labelsLoaded) {
            return;
        }
        ListLabelsResponse response = gmail.users().labels().list(userId).execute();
        if (response.getLabels() != null) {
            for (Label label : response.getLabels()) {
                labelIds.put(label.getName(), label.getId());
                labelNames.put(label.getId(), label.getName());
            }
        }
        labelsLoaded = true;
    }

    @FunctionalInterface
    private interface GmailCall<T> {
        T execute() throws IOException;
    }
}
