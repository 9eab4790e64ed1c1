package mailbox.jobs.app.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class EventStreamUnavailableException extends RuntimeException {
    public EventStreamUnavailableException(String jobId, Throwable cause) {
        super("Too many open event streams, cannot tail job " + jobId, cause);
    }
}
