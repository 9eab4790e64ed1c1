package mailbox.jobs.app.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import mailbox.jobs.app.exception.InvalidJobPayloadException;
import mailbox.jobs.app.model.TriageAction;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriageApplyPayload implements JobPayload {
    private List<Item> items;

    @JsonProperty("auto_apply_high_confidence")
    private Boolean autoApplyHighConfidence;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        private String uid;
        private String folder;
        private String label;
        @JsonProperty("remove_label")
        private String removeLabel;
        @Builder.Default
        private List<String> actions = new ArrayList<>();
        @Builder.Default
        private Double confidence = 0.0;
    }

    @Override
    public void validate() {
        if (items == null) {
            throw new InvalidJobPayloadException("items is required");
        }
        for (Item item : items) {
            if (item == null || item.getUid() == null || item.getUid().isBlank()) {
                throw new InvalidJobPayloadException("every triage item needs a uid");
            }
            double confidence = item.getConfidence() == null ? 0.0 : item.getConfidence();
            if (confidence < 0.0 || confidence > 1.0) {
                throw new InvalidJobPayloadException("confidence must be within [0,1] for uid " + item.getUid());
            }
            if (item.getActions() != null) {
                item.getActions().forEach(TriageAction::fromValue);
            }
        }
    }

    @Override
    public int itemCount() {
        return items == null ? 0 : items.size();
    }

    public boolean autoApply() {
        return autoApplyHighConfidence == null || autoApplyHighConfidence;
    }
}
