package mailbox.jobs.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TriageClassification {
    String uid;
    String folder;
    String category;
    double confidence;
    String reasoning;
    @Singular
    List<String> actions;
}
