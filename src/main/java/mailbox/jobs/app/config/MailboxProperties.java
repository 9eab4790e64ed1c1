package mailbox.jobs.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "mailbox")
public class MailboxProperties {

    private Pool pool = new Pool();

    /** Folder that "archive" moves to. Moving there only drops the source folder label. */
    private String archiveFolder = "[Gmail]/All Mail";

    private List<String> syncFolders = new ArrayList<>(List.of("INBOX"));

    /** Page size used when listing remote folders. */
    private int syncPageSize = 100;

    private Gmail gmail = new Gmail();

    @Data
    public static class Pool {
        private int size = 3;

        private Duration acquireTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Gmail {
        private String userId = "me";

        private String accessToken = "";
    }
}
