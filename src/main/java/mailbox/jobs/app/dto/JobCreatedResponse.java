package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobCreatedResponse {
    @JsonProperty("job_id")
    String jobId;
    String status;
    Integer count;
}
