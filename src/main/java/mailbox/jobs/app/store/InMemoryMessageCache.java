package mailbox.jobs.app.store;

import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.MailMessage;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class InMemoryMessageCache implements MessageCache {
    private static final Comparator<MailMessage> NEWEST_FIRST = Comparator
        .comparing(MailMessage::getDate, Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(MailMessage::getUid);

    private final Map<MailItemRef, MailMessage> messages = new LinkedHashMap<>();

    @Override
    public synchronized void upsert(MailMessage message) {
        messages.put(message.ref(), message);
    }

    @Override
    public synchronized int retainOnly(String folder, Collection<String> presentUids) {
        Set<String> present = new HashSet<>(presentUids);
        int before = messages.size();
        messages.keySet().removeIf(ref -> ref.getFolder().equals(folder) && !present.contains(ref.getUid()));
        return before - messages.size();
    }

    @Override
    public synchronized List<MailMessage> findUnread(String folder, int limit) {
        return inFolder(folder).filter(MailMessage::isUnread).limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized List<MailMessage> page(String folder, int offset, int limit) {
        return inFolder(folder).skip(offset).limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized long count(String folder) {
        return inFolder(folder).count();
    }

    @Override
    public synchronized void markRead(MailItemRef item) {
        messages.computeIfPresent(item, (ref, message) -> message.toBuilder().unread(false).build());
    }

    @Override
    public synchronized void remove(MailItemRef item) {
        messages.remove(item);
    }

    @Override
    public synchronized void addLabel(MailItemRef item, String label) {
        messages.computeIfPresent(item, (ref, message) ->
            message.getLabels().contains(label) ? message : message.toBuilder().label(label).build());
    }

    @Override
    public synchronized void removeLabel(MailItemRef item, String label) {
        messages.computeIfPresent(item, (ref, message) -> {
            List<String> labels = new ArrayList<>(message.getLabels());
            labels.remove(label);
            return message.toBuilder().clearLabels().labels(labels).build();
        });
    }

    private Stream<MailMessage> inFolder(String folder) {
        return messages.values().stream()
            .filter(message -> message.getFolder().equals(folder))
            .sorted(NEWEST_FIRST);
    }
}
