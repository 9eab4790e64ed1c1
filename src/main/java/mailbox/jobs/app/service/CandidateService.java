package mailbox.jobs.app.service;

import mailbox.jobs.app.dto.CandidateBuckets;
import mailbox.jobs.app.dto.CandidateView;
import mailbox.jobs.app.entity.JobCandidate;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.exception.JobNotFoundException;
import mailbox.jobs.app.model.ConfidenceBucket;
import mailbox.jobs.app.store.JobStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CandidateService {
    static final int DEFAULT_LIMIT = 500;

    private final JobStore store;

    public CandidateService(JobStore store) {
        this.store = store;
    }

    /**
     * Candidates of a job, highest confidence first, split into review buckets.
     */
    public CandidateBuckets listCandidates(String jobId, Double minConfidence, String category, Integer limit) {
        MailboxJob job = store.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;

        List<CandidateView> high = new ArrayList<>();
        List<CandidateView> medium = new ArrayList<>();
        List<CandidateView> low = new ArrayList<>();
        List<JobCandidate> candidates = store.listCandidates(jobId, minConfidence, category, effectiveLimit);
        for (JobCandidate candidate : candidates) {
            switch (ConfidenceBucket.of(candidate.getConfidence())) {
                case HIGH:
                    high.add(CandidateView.of(candidate));
                    break;
                case MEDIUM:
                    medium.add(CandidateView.of(candidate));
                    break;
                default:
                    low.add(CandidateView.of(candidate));
            }
        }
        return new CandidateBuckets(jobId, job.getStatus().getValue(), candidates.size(), high, medium, low);
    }
}
