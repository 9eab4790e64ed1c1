package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import mailbox.jobs.app.entity.JobCandidate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CandidateView {
    long id;
    String uid;
    String folder;
    @JsonProperty("message_id")
    String messageId;
    String from;
    String to;
    String cc;
    String subject;
    Instant date;
    @JsonProperty("body_preview")
    String bodyPreview;
    String category;
    double confidence;
    Map<String, Object> signals;
    @JsonProperty("proposed_actions")
    List<String> proposedActions;
    @JsonProperty("user_decision")
    String userDecision;

    public static CandidateView of(JobCandidate candidate) {
        return CandidateView.builder()
            .id(candidate.getId())
            .uid(candidate.getUid())
            .folder(candidate.getFolder())
            .messageId(candidate.getMessageId())
            .from(candidate.getFromAddr())
            .to(candidate.getToAddr())
            .cc(candidate.getCcAddr())
            .subject(candidate.getSubject())
            .date(candidate.getDate())
            .bodyPreview(candidate.getBodyPreview())
            .category(candidate.getCategory())
            .confidence(candidate.getConfidence())
            .signals(candidate.getSignals())
            .proposedActions(candidate.getProposedActions())
            .userDecision(candidate.getUserDecision())
            .build();
    }
}
