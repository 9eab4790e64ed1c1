package mailbox.jobs.app.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import mailbox.jobs.app.exception.InvalidJobPayloadException;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncPayload implements JobPayload {
    // Falls back to mailbox.sync-folders when absent
    private List<String> folders;

    @Override
    public void validate() {
        if (folders != null && folders.stream().anyMatch(f -> f == null || f.isBlank())) {
            throw new InvalidJobPayloadException("folders must not contain blank names");
        }
    }
}
