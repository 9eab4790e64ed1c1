package mailbox.jobs.app.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidJobPayloadException extends RuntimeException {
    public InvalidJobPayloadException(String message) {
        super(message);
    }

    public InvalidJobPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
