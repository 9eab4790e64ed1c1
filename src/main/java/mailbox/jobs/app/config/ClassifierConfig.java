package mailbox.jobs.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import mailbox.jobs.app.classifier.OpenAiTriageClassifier;
import mailbox.jobs.app.classifier.TriageClassifier;
import mailbox.jobs.app.classifier.UnclassifiedTriageClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration to switch between classifier providers.
 * Set ai.provider=openai or ai.provider=none in application.properties
 */
@Configuration
public class ClassifierConfig {

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai", matchIfMissing = true)
    public TriageClassifier openAiTriageClassifier(
            @Value("${openai.api.key:}") String apiKey,
            @Value("${openai.model:gpt-3.5-turbo}") String model) {
        OpenAiService openAiService = new OpenAiService(apiKey, Duration.ofSeconds(60));
        return new OpenAiTriageClassifier(openAiService, new ObjectMapper(), model);
    }

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "none")
    public TriageClassifier unclassifiedTriageClassifier() {
        return new UnclassifiedTriageClassifier();
    }
}
