package mailbox.jobs.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import mailbox.jobs.app.entity.CachedMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class MailMessage {
    String uid;
    String folder;
    String messageId;
    String fromAddr;
    String toAddr;
    String ccAddr;
    String subject;
    Instant date;
    String bodyText;
    boolean unread;
    @Singular
    List<String> labels;

    public MailItemRef ref() {
        return MailItemRef.of(uid, folder);
    }

    public static MailMessage fromCached(CachedMessage cached) {
        return MailMessage.builder()
            .uid(cached.getUid())
            .folder(cached.getFolder())
            .messageId(cached.getMessageId())
            .fromAddr(cached.getFromAddr())
            .toAddr(cached.getToAddr())
            .ccAddr(cached.getCcAddr())
            .subject(cached.getSubject())
            .date(cached.getDate())
            .bodyText(cached.getBodyText())
            .unread(cached.isUnread())
            .labels(cached.getLabels() == null ? List.of() : cached.getLabels())
            .build();
    }

    public CachedMessage toCached(Instant syncedAt) {
        return CachedMessage.builder()
            .uid(uid)
            .folder(folder)
            .messageId(messageId)
            .fromAddr(fromAddr)
            .toAddr(toAddr)
            .ccAddr(ccAddr)
            .subject(subject)
            .date(date)
            .bodyText(bodyText)
            .unread(unread)
            .labels(new ArrayList<>(labels))
            .syncedAt(syncedAt)
            .build();
    }
}
