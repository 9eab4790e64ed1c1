package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One page of the continuation scan. {@code continuationToken} is null once the folder is exhausted.
 */
@Value
@Builder
public class ScanResult {
    String status;
    @JsonProperty("has_more")
    boolean hasMore;
    @JsonProperty("continuation_token")
    String continuationToken;
    @JsonProperty("job_id")
    String jobId;
    @JsonProperty("total_processed")
    int totalProcessed;
    @JsonProperty("high_confidence_count")
    int highConfidenceCount;
    @JsonProperty("needs_review_count")
    int needsReviewCount;
    Map<String, Integer> summary;
}
