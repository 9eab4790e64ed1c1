package mailbox.jobs.app.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import mailbox.jobs.app.exception.InvalidJobPayloadException;
import mailbox.jobs.app.model.TriageAction;

import java.util.List;

/**
 * The human decision: which candidates and which actions to apply to them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalPayload implements JobPayload {
    @JsonProperty("candidate_ids")
    private List<Long> candidateIds;

    private List<String> actions;

    @Override
    public void validate() {
        if (candidateIds == null || candidateIds.stream().anyMatch(id -> id == null)) {
            throw new InvalidJobPayloadException("candidate_ids is required and must not contain nulls");
        }
        if (actions == null) {
            throw new InvalidJobPayloadException("actions is required");
        }
        actions.forEach(TriageAction::fromValue);
    }

    @Override
    public int itemCount() {
        return candidateIds == null ? 0 : candidateIds.size();
    }
}
