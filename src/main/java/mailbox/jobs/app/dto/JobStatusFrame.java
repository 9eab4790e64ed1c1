package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import mailbox.jobs.app.entity.MailboxJob;

@Value
public class JobStatusFrame {
    String type = "job_status";
    String status;
    int processed;
    @JsonProperty("total_estimate")
    Integer totalEstimate;
    @JsonProperty("cancel_requested")
    boolean cancelRequested;

    public static JobStatusFrame of(MailboxJob job) {
        return new JobStatusFrame(job.getStatus().getValue(), job.getProcessed(), job.getTotalEstimate(),
            job.isCancelRequested());
    }
}
