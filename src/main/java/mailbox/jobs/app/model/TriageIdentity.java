package mailbox.jobs.app.model;

import lombok.Value;

import java.util.List;

/**
 * Who the mailbox belongs to, handed to the classifier so it can recognise direct mail and VIPs.
 */
@Value
public class TriageIdentity {
    String userEmail;
    String userName;
    List<String> vipSenders;
}
