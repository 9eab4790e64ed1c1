package mailbox.jobs.app.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import mailbox.jobs.app.exception.InvalidJobPayloadException;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriagePreviewPayload implements JobPayload {
    private String folder;
    private Integer limit;

    @Override
    public void validate() {
        if (folder != null && folder.isBlank()) {
            throw new InvalidJobPayloadException("folder must not be blank");
        }
        if (limit != null && limit <= 0) {
            throw new InvalidJobPayloadException("limit must be positive");
        }
    }
}
