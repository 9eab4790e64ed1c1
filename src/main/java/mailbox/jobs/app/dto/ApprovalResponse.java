package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ApprovalResponse {
    boolean ok;
    @JsonProperty("job_id")
    String jobId;
    String status;
    @JsonProperty("candidate_count")
    int candidateCount;
}
