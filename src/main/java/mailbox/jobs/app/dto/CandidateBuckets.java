package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Candidates of a preview job split by confidence bucket.
 */
@Value
public class CandidateBuckets {
    @JsonProperty("job_id")
    String jobId;
    @JsonProperty("job_status")
    String jobStatus;
    int total;
    @JsonProperty("high_confidence")
    List<CandidateView> highConfidence;
    @JsonProperty("medium_confidence")
    List<CandidateView> mediumConfidence;
    @JsonProperty("low_confidence")
    List<CandidateView> lowConfidence;
}
