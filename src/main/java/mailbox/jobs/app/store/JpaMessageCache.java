package mailbox.jobs.app.store;

import mailbox.jobs.app.entity.CachedMessage;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.repository.CachedMessageRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.*;
import java.util.stream.Collectors;

public class JpaMessageCache implements MessageCache {
    private final CachedMessageRepository repository;
    private final Clock clock;

    public JpaMessageCache(CachedMessageRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void upsert(MailMessage message) {
        CachedMessage fresh = message.toCached(clock.instant());
        repository.findByUidAndFolder(message.getUid(), message.getFolder())
            .ifPresent(existing -> fresh.setId(existing.getId()));
        repository.save(fresh);
    }

    @Override
    @Transactional
    public int retainOnly(String folder, Collection<String> presentUids) {
        Set<String> present = new HashSet<>(presentUids);
        int removed = 0;
        for (String uid : repository.findUidsByFolder(folder)) {
            if (!present.contains(uid)) {
                removed += (int) repository.deleteByUidAndFolder(uid, folder);
            }
        }
        return removed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MailMessage> findUnread(String folder, int limit) {
        return repository.findByFolderAndUnreadTrueOrderByDateDescIdAsc(folder, PageRequest.of(0, limit)).stream()
            .map(MailMessage::fromCached)
            .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<MailMessage> page(String folder, int offset, int limit) {
        return repository.findPage(folder, offset, limit).stream()
            .map(MailMessage::fromCached)
            .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public long count(String folder) {
        return repository.countByFolder(folder);
    }

    @Override
    @Transactional
    public void markRead(MailItemRef item) {
        repository.findByUidAndFolder(item.getUid(), item.getFolder()).ifPresent(cached -> {
            cached.setUnread(false);
            repository.save(cached);
        });
    }

    @Override
    @Transactional
    public void remove(MailItemRef item) {
        repository.deleteByUidAndFolder(item.getUid(), item.getFolder());
    }

    @Override
    @Transactional
    public void addLabel(MailItemRef item, String label) {
        repository.findByUidAndFolder(item.getUid(), item.getFolder()).ifPresent(cached -> {
            List<String> labels = new ArrayList<>(cached.getLabels());
            if (!labels.contains(label)) {
                labels.add(label);
                cached.setLabels(labels);
                repository.save(cached);
            }
        });
    }

    @Override
    @Transactional
    public void removeLabel(MailItemRef item, String label) {
        repository.findByUidAndFolder(item.getUid(), item.getFolder()).ifPresent(cached -> {
            List<String> labels = new ArrayList<>(cached.getLabels());
            if (labels.remove(label)) {
                cached.setLabels(labels);
                repository.save(cached);
            }
        });
    }
}
