package mailbox.jobs.app.config;

import lombok.Data;
import mailbox.jobs.app.model.TriageIdentity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    /** Labels applied by triage are {@code <labelPrefix>/<Category>}. */
    private String labelPrefix = "Triage";

    /** Default number of unread messages a preview job classifies. */
    private int previewLimit = 500;

    /** Default page size of the continuation scan. */
    private int scanLimit = 500;

    private String cleanupDestination = "Triage/Auto-Cleaned";

    private String userEmail = "";

    private String userName = "";

    private List<String> vipSenders = new ArrayList<>();

    public TriageIdentity identity() {
        return new TriageIdentity(userEmail, userName, List.copyOf(vipSenders));
    }
}
