package mailbox.jobs.app.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.TriageAction;
import mailbox.jobs.app.model.TriageClassification;
import mailbox.jobs.app.model.TriageIdentity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completion backed classifier. Messages are sent in small batches and the model answers
 * with a JSON array keyed by message uid.
 */
@Slf4j
public class OpenAiTriageClassifier implements TriageClassifier {
    static final int BATCH_SIZE = 20;
    private static final int PREVIEW_CHARS = 500;

    private final OpenAiService openAiService;
    private final ObjectMapper objectMapper;
    private final String model;

    public OpenAiTriageClassifier(OpenAiService openAiService, ObjectMapper objectMapper, String model) {
        this.openAiService = openAiService;
        this.objectMapper = objectMapper;
        this.model = model;
    }

    @Override
    public List<TriageClassification> classify(List<MailMessage> messages, TriageIdentity identity) {
        List<TriageClassification> results = new ArrayList<>();
        for (int i = 0; i < messages.size(); i += BATCH_SIZE) {
            List<MailMessage> batch = messages.subList(i, Math.min(i + BATCH_SIZE, messages.size()));
            results.addAll(classifyBatch(batch, identity));
        }
        return results;
    }

    private List<TriageClassification> classifyBatch(List<MailMessage> batch, TriageIdentity identity) {
        String response;
        try {
            ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(new ChatMessage("user", buildPrompt(batch, identity))))
                .maxTokens(120 * batch.size())
                .temperature(0.2)
                .build();

            response = openAiService.createChatCompletion(request)
                .getChoices().get(0).getMessage().getContent().trim();
        } catch (Exception e) {
            throw translateError(e);
        }

        Map<String, JsonNode> byUid = parseResponse(response);
        List<TriageClassification> results = new ArrayList<>();
        for (MailMessage message : batch) {
            JsonNode node = byUid.get(message.getUid());
            results.add(node == null ? unclassified(message) : toClassification(message, node));
        }
        return results;
    }

    String buildPrompt(List<MailMessage> batch, TriageIdentity identity) {
        StringBuilder categories = new StringBuilder();
        for (TriageCategory category : TriageCategory.values()) {
            categories.append(String.format("- %s: %s\n", category.getValue(), category.getDescription()));
        }

        StringBuilder emails = new StringBuilder();
        for (MailMessage message : batch) {
            String body = message.getBodyText() == null ? "" : message.getBodyText();
            emails.append(String.format("uid: %s\nFrom: %s\nTo: %s\nCc: %s\nSubject: %s\nBody: %s\n---\n",
                message.getUid(),
                message.getFromAddr(),
                message.getToAddr(),
                message.getCcAddr(),
                message.getSubject(),
                body.length() > PREVIEW_CHARS ? body.substring(0, PREVIEW_CHARS) + "..." : body));
        }

        return String.format(
            "You triage the mailbox of %s <%s>. VIP senders: %s.\n\n" +
            "Classify each email into one of these categories:\n\n%s\n" +
            "Emails:\n%s\n" +
            "Respond with ONLY a JSON array, one object per email: " +
            "[{\"uid\": \"...\", \"category\": \"...\", \"confidence\": 0.0-1.0, \"reasoning\": \"...\"}]",
            identity.getUserName(),
            identity.getUserEmail(),
            identity.getVipSenders() == null || identity.getVipSenders().isEmpty()
                ? "none" : String.join(", ", identity.getVipSenders()),
            categories,
            emails);
    }

    private Map<String, JsonNode> parseResponse(String response) {
        Map<String, JsonNode> byUid = new HashMap<>();
        String json = response;
        int start = json.indexOf('[');
        int end = json.lastIndexOf(']');
        if (start >= 0 && end > start) {
            json = json.substring(start, end + 1);
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root.isArray()) {
                for (JsonNode node : root) {
                    if (node.hasNonNull("uid")) {
                        byUid.put(node.get("uid").asText(), node);
                    }
                }
            }
        } catch (Exception e) {
            log.warn("Could not parse classifier response, leaving batch unclassified: {}", e.getMessage());
        }
        return byUid;
    }

    private TriageClassification toClassification(MailMessage message, JsonNode node) {
        TriageCategory category = TriageCategory.fromValue(node.path("category").asText(null));
        double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.0)));
        TriageClassification.TriageClassificationBuilder builder = TriageClassification.builder()
            .uid(message.getUid())
            .folder(message.getFolder())
            .category(category.getValue())
            .confidence(confidence)
            .reasoning(node.path("reasoning").asText(""));
        for (TriageAction action : category.getDefaultActions()) {
            builder.action(action.getValue());
        }
        return builder.build();
    }

    private TriageClassification unclassified(MailMessage message) {
        return TriageClassification.builder()
            .uid(message.getUid())
            .folder(message.getFolder())
            .category(TriageCategory.UNCLEAR.getValue())
            .confidence(0.0)
            .reasoning("Not classified by model")
            .build();
    }

    private RuntimeException translateError(Exception e) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        if (e instanceof OpenAiHttpException ||
            errorMessage.contains("quota") ||
            errorMessage.contains("rate limit") ||
            (e.getCause() != null && e.getCause().getMessage() != null &&
             e.getCause().getMessage().contains("429"))) {
            return new QuotaException("OpenAI quota/rate limit exceeded during triage: " + e.getMessage(), e);
        }
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new RuntimeException("OpenAI API error during triage: " + e.getMessage(), e);
    }
}
