package com.opsdiag.llm.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdiag.llm.LlmClient;
import com.opsdiag.llm.LlmException;
import com.opsdiag.report.IncidentReport;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class HttpLlmClient implements LlmClient {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.HttpLlmClient");

    static final String SYSTEM_PROMPT = """
            You are an on-call assistant. You will receive a JSON `report` describing an incident
            and the ranked root-cause hypotheses produced by a rule engine.
            - Do NOT invent data. Only explain what the `report` contains.
            - Keep the ranking order: the first hypothesis is the most likely one.
            - Sections: Summary, Most likely cause (with evidence), Other hypotheses, Mitigation.
            - If the report has no hypothesis, say that manual investigation is required.
            """;

    static final String FALLBACK = "The narrative provider returned an empty answer (fallback).";

    private static final String DEFAULT_MODEL = "granite-7b-instruct";

    @ConfigProperty(name = "llm.endpoint")
    Optional<String> endpoint = Optional.empty();

    @ConfigProperty(name = "llm.model")
    Optional<String> model = Optional.empty();

    @ConfigProperty(name = "llm.api-key")
    Optional<String> apiKey = Optional.empty();

    @Inject
    ObjectMapper mapper;

    private volatile ChatLanguageModel chatModel;

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] HttpLlmClient ready. endpoint={0} model={1} apiKeyConfigured={2}",
                endpoint.orElse("<none>"),
                resolveModel(),
                apiKey.map(value -> !value.isBlank()).orElse(false));
    }

    @Override
    public String narrate(IncidentReport report) {
        URI target = resolveTarget();
        String requestId = UUID.randomUUID().toString();
        Instant start = Instant.now();
        try {
            String prettyReport = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
            String prompt = buildPrompt(prettyReport);
            LOGGER.infov(
                    "[COMM-START] requestId={0} target={1} model={2} incidentId={3}",
                    requestId,
                    target,
                    resolveModel(),
                    report.incidentId());
            String response = chatLanguageModel(target).generate(prompt);
            LOGGER.infov(
                    "[COMM-END] requestId={0} target={1} durationMs={2}",
                    requestId,
                    target,
                    Duration.between(start, Instant.now()).toMillis());
            return extractContent(response);
        } catch (Exception e) {
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s target=%s model=%s", requestId, target, resolveModel());
            throw new LlmException("LLM call failed", e);
        }
    }

    String buildPrompt(String prettyReport) {
        return SYSTEM_PROMPT
                + "\n\n"
                + "report:\n"
                + "```json\n"
                + prettyReport
                + "\n```";
    }

    private URI resolveTarget() {
        String value = endpoint.map(String::trim).filter(v -> !v.isEmpty())
                .orElseThrow(() -> new LlmException("llm.endpoint not configured"));
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new LlmException("llm.endpoint invalid: " + value, e);
        }
    }

    private String extractContent(String response) {
        return Optional.ofNullable(response)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .orElse(FALLBACK);
    }

    private String resolveModel() {
        return model
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .orElse(DEFAULT_MODEL);
    }

    private ChatLanguageModel buildChatModel(URI target) {
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .modelName(resolveModel())
                .baseUrl(normalizeBaseUrl(target))
                .temperature(0.2d)
                .maxTokens(Integer.valueOf(800));

        apiKey.map(String::trim)
                .filter(value -> !value.isEmpty())
                .ifPresent(builder::apiKey);

        return builder.build();
    }

    private ChatLanguageModel chatLanguageModel(URI target) {
        ChatLanguageModel current = this.chatModel;
        if (current == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = buildChatModel(target);
                }
                current = chatModel;
            }
        }
        return current;
    }

    private String normalizeBaseUrl(URI target) {
        String value = target.toString().trim();
        if (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    void setChatModel(ChatLanguageModel chatLanguageModel) {
        this.chatModel = chatLanguageModel;
    }
}
