package mailbox.jobs.app.controller;

import mailbox.jobs.app.dto.MutationView;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.store.MutationJournal;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only audit lookups over the mutation journal.
 */
@RestController
@RequestMapping("/api/mutations")
public class MutationJournalController {
    private final MutationJournal journal;

    public MutationJournalController(MutationJournal journal) {
        this.journal = journal;
    }

    @GetMapping
    public List<MutationView> history(@RequestParam String uid, @RequestParam(defaultValue = "INBOX") String folder) {
        return journal.history(MailItemRef.of(uid, folder)).stream()
            .map(MutationView::of)
            .collect(Collectors.toList());
    }

    @GetMapping("/pending")
    public List<MutationView> pending(@RequestParam String uid, @RequestParam(defaultValue = "INBOX") String folder) {
        return journal.pending(MailItemRef.of(uid, folder)).stream()
            .map(MutationView::of)
            .collect(Collectors.toList());
    }

    @GetMapping("/{mutationId}")
    public ResponseEntity<MutationView> get(@PathVariable long mutationId) {
        return journal.get(mutationId)
            .map(MutationView::of)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
