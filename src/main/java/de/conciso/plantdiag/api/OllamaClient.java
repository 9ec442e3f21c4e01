package de.conciso.plantdiag.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.conciso.plantdiag.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ollama-Anbindung über /api/generate (nicht gestreamt).
 * Wird nur für den abschließenden Diagnosetext verwendet, nie für die Fragenauswahl.
 */
@Component
public class OllamaClient implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    static final String SYSTEM_PROMPT = """
            Provide plant disease diagnosis with:
            1) Symptom analysis
            2) Disease identification
            3) Treatment recommendations
            4) Prevention measures""";

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final RestClient restClient;
    private final String model;
    private final double temperature;
    private final int numPredict;

    @Autowired
    public OllamaClient(
            @Value("${diagnostic.ollama.url}") String baseUrl,
            @Value("${diagnostic.ollama.model}") String model,
            @Value("${diagnostic.ollama.timeout-seconds:60}") int timeoutSeconds,
            @Value("${diagnostic.ollama.temperature:0.6}") double temperature,
            @Value("${diagnostic.ollama.num-predict:500}") int numPredict
    ) {
        this(RestClient.builder()
                        .baseUrl(baseUrl)
                        .requestFactory(requestFactory(Duration.ofSeconds(timeoutSeconds)))
                        .build(),
                model, temperature, numPredict);
    }

    OllamaClient(RestClient restClient, String model, double temperature, int numPredict) {
        this.restClient = restClient;
        this.model = model;
        this.temperature = temperature;
        this.numPredict = numPredict;
    }

    @Override
    public String generate(List<String> symptoms, String context) {
        String prompt = buildPrompt(symptoms, context);
        try {
            GenerateResponse response = restClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of(
                            "model", model,
                            "prompt", prompt,
                            "stream", false,
                            "options", Map.of("temperature", temperature, "num_predict", numPredict)
                    ))
                    .retrieve()
                    .body(GenerateResponse.class);

            if (response == null || response.response() == null) {
                log.warn("Empty /api/generate response from model {}", model);
                return "Error generating summary: empty response from " + model;
            }
            return response.response().trim();
        } catch (RuntimeException e) {
            log.warn("Text generation failed: {}", e.getMessage());
            log.debug("Text generation failure", e);
            return "Error generating summary: " + e.getMessage();
        }
    }

    @Override
    public HealthStatus healthCheck() {
        try {
            TagsResponse tags = restClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .body(TagsResponse.class);

            List<String> models = tags == null || tags.models() == null ? List.of() :
                    tags.models().stream()
                            .map(ModelTag::name)
                            .filter(Objects::nonNull)
                            .toList();
            if (models.contains(model)) {
                return new HealthStatus(true, model + " available");
            }
            return new HealthStatus(false, model + " not found. Available: " + models);
        } catch (RuntimeException e) {
            return new HealthStatus(false, "Connection failed: " + e.getMessage());
        }
    }

    static String buildPrompt(List<String> symptoms, String context) {
        return SYSTEM_PROMPT + "\n\nCONTEXT: " + (context == null ? "" : context)
                + "\nSYMPTOMS: " + String.join(", ", symptoms == null ? List.of() : symptoms);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) CONNECT_TIMEOUT.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }

    // --- response records ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(String response, Boolean done) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TagsResponse(List<ModelTag> models) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ModelTag(String name) {}
}
