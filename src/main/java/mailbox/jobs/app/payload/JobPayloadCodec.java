package mailbox.jobs.app.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.exception.InvalidJobPayloadException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts between the opaque JSON documents persisted on a job and the typed payload of its kind.
 */
@Component
public class JobPayloadCodec {
    private final ObjectMapper objectMapper;

    public JobPayloadCodec() {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public static Class<? extends JobPayload> payloadType(JobKind kind) {
        switch (kind) {
            case MAILBOX_SYNC:
                return SyncPayload.class;
            case TRIAGE_PREVIEW:
                return TriagePreviewPayload.class;
            case BULK_CLEANUP:
                return BulkCleanupPayload.class;
            case TRIAGE_APPLY:
                return TriageApplyPayload.class;
            default:
                throw new IllegalArgumentException("No payload type for " + kind);
        }
    }

    /**
     * Validates a raw producer payload against the kind's schema.
     * @param raw decoded request body, null meaning "all defaults"
     * @return the validated payload
     * @throws InvalidJobPayloadException if the document does not match the schema
     */
    public JobPayload parse(JobKind kind, Map<String, Object> raw) {
        JobPayload payload;
        try {
            payload = objectMapper.convertValue(raw == null ? Map.of() : raw, payloadType(kind));
        } catch (IllegalArgumentException e) {
            throw new InvalidJobPayloadException("Invalid " + kind.getValue() + " payload: " + e.getMessage(), e);
        }
        payload.validate();
        return payload;
    }

    public String encode(JobPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidJobPayloadException("Could not encode payload: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a persisted payload. A missing document decodes to the type's defaults.
     */
    public <T extends JobPayload> T decode(String json, Class<T> type) {
        try {
            if (json == null || json.isBlank()) {
                return type.getDeclaredConstructor().newInstance();
            }
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new InvalidJobPayloadException("Stored payload is not a valid " + type.getSimpleName() + ": " + e.getMessage(), e);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + type.getSimpleName(), e);
        }
    }
}
