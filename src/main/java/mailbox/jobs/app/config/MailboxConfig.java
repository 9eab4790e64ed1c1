package mailbox.jobs.app.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.mailbox.GmailMailboxClient;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class MailboxConfig {

    @Bean
    @ConditionalOnMissingBean
    public MailboxConnectionPool mailboxConnectionPool(MailboxProperties properties)
            throws GeneralSecurityException, IOException {
        NetHttpTransport httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        MailboxProperties.Gmail gmail = properties.getGmail();
        if (gmail.getAccessToken() == null || gmail.getAccessToken().isBlank()) {
            log.warn("mailbox.gmail.access-token is not set; mailbox jobs will fail until it is configured");
        }

        List<GmailMailboxClient> connections = new ArrayList<>();
        for (int i = 0; i < properties.getPool().getSize(); i++) {
            connections.add(new GmailMailboxClient(
                GmailMailboxClient.connect(httpTransport, gmail.getAccessToken()),
                gmail.getUserId(),
                properties.getArchiveFolder()));
        }
        log.info("Mailbox pool ready with {} Gmail connections for {}", connections.size(), gmail.getUserId());
        return new MailboxConnectionPool(connections, properties.getPool().getAcquireTimeout());
    }
}
