package mailbox.jobs.app.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ApprovalConflictException extends RuntimeException {
    public ApprovalConflictException(String jobId) {
        super("Job already approved: " + jobId);
    }
}
