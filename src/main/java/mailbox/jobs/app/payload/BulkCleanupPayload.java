package mailbox.jobs.app.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import mailbox.jobs.app.exception.InvalidJobPayloadException;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BulkCleanupPayload implements JobPayload {
    private List<CleanupTarget> uids;
    private String destination;
    @JsonProperty("mark_read")
    private Boolean markRead;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CleanupTarget {
        private String uid;
        private String folder;
    }

    @Override
    public void validate() {
        if (uids == null) {
            throw new InvalidJobPayloadException("uids is required");
        }
        for (CleanupTarget target : uids) {
            if (target == null || target.getUid() == null || target.getUid().isBlank()) {
                throw new InvalidJobPayloadException("every cleanup target needs a uid");
            }
        }
        if (destination != null && destination.isBlank()) {
            throw new InvalidJobPayloadException("destination must not be blank");
        }
    }

    @Override
    public int itemCount() {
        return uids == null ? 0 : uids.size();
    }
}
