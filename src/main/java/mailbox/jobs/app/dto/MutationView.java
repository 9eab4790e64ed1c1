package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import mailbox.jobs.app.entity.MutationRecord;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class MutationView {
    long id;
    @JsonProperty("email_uid")
    String emailUid;
    @JsonProperty("email_folder")
    String emailFolder;
    String action;
    Map<String, Object> params;
    String status;
    @JsonProperty("pre_state")
    Map<String, Object> preState;
    String error;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("updated_at")
    Instant updatedAt;

    public static MutationView of(MutationRecord record) {
        return MutationView.builder()
            .id(record.getId())
            .emailUid(record.getEmailUid())
            .emailFolder(record.getEmailFolder())
            .action(record.getAction())
            .params(record.getParams())
            .status(record.getStatus().getValue())
            .preState(record.getPreState())
            .error(record.getError())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
