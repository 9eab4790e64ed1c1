package mailbox.jobs.app.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when an operation needs the job to be in a different status or of a different kind.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalJobStateException extends RuntimeException {
    public IllegalJobStateException(String message) {
        super(message);
    }
}
