package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import mailbox.jobs.app.entity.JobEvent;

import java.time.Instant;
import java.util.Map;

@Value
public class JobEventView {
    String type = "job_event";
    long id;
    @JsonProperty("created_at")
    Instant createdAt;
    String level;
    String message;
    Map<String, Object> data;

    public static JobEventView of(JobEvent event) {
        return new JobEventView(event.getId(), event.getCreatedAt(), event.getLevel().getValue(),
            event.getMessage(), event.getData());
    }
}
