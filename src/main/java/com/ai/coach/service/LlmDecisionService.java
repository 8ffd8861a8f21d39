package com.ai.coach.service;

import com.ai.coach.dto.GenerativeDecision;
import com.ai.coach.dto.PromptContext;
import com.ai.coach.engine.GenerativeDecisionClient;
import com.ai.coach.exception.GenerativeCallFailedException;
import com.ai.coach.exception.MalformedGenerativeResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks an OpenAI-compatible chat completions endpoint to pick the next navigation
 * decision. One attempt per call; timeouts come from configuration.
 */
@Service
public class LlmDecisionService implements GenerativeDecisionClient {

    private static final Logger log = LoggerFactory.getLogger(LlmDecisionService.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${coach.llm.enabled:true}")
    private boolean enabled;

    @Value("${coach.llm.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${coach.llm.api-key:}")
    private String apiKey;

    @Value("${coach.llm.model:gpt-4o-mini}")
    private String model;

    @Value("${coach.llm.temperature:0.3}")
    private double temperature;

    public LlmDecisionService(RestTemplateBuilder builder,
                              @Value("${coach.llm.connect-timeout-ms:3000}") long connectTimeoutMs,
                              @Value("${coach.llm.read-timeout-ms:15000}") long readTimeoutMs) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    public boolean isEnabled() {
        return enabled && StringUtils.isNotBlank(apiKey);
    }

    @Override
    public GenerativeDecision generateDecision(PromptContext context) {
        if (!enabled) {
            throw new GenerativeCallFailedException("Generative decisions are disabled");
        }
        if (StringUtils.isBlank(apiKey)) {
            throw new GenerativeCallFailedException("coach.llm.api-key is not set");
        }

        String url = StringUtils.removeEnd(baseUrl, "/") + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        Map<String, String> systemMsg = new HashMap<>();
        systemMsg.put("role", "system");
        systemMsg.put("content", systemPrompt(context));
        messages.add(systemMsg);
        Map<String, String> userMsg = new HashMap<>();
        userMsg.put("role", "user");
        userMsg.put("content", userPrompt(context));
        messages.add(userMsg);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("messages", messages);

        String content;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            if (response.getBody() == null) {
                throw new GenerativeCallFailedException("Chat completion returned an empty body");
            }
            JsonNode root = mapper.readTree(response.getBody());
            content = root.path("choices").path(0).path("message").path("content").asText("").trim();
        } catch (RestClientException | JsonProcessingException ex) {
            throw new GenerativeCallFailedException("Chat completion request failed: " + ex.getMessage(), ex);
        }
        log.debug("[{}] Generative raw reply: {}", context.getSessionId(), content);
        return parseDecision(content);
    }

    /**
     * Reads the first JSON object in the model reply. Fields may be missing; a reply
     * with no JSON object at all is malformed.
     */
    GenerativeDecision parseDecision(String content) {
        int start = content == null ? -1 : content.indexOf('{');
        int end = content == null ? -1 : content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedGenerativeResponseException("Reply contains no JSON object");
        }
        JsonNode node;
        try {
            node = mapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException ex) {
            throw new MalformedGenerativeResponseException("Reply JSON could not be parsed", ex);
        }
        List<String> blockedBy = new ArrayList<>();
        node.path("blocked_by").forEach(n -> blockedBy.add(n.asText()));
        return GenerativeDecision.builder()
                .decision(text(node, "decision"))
                .situationType(text(node, "situation_type"))
                .retrievalTag(text(node, "retrieval_tag"))
                .readyForNext(node.hasNonNull("ready_for_next") ? node.get("ready_for_next").asBoolean() : null)
                .blockedBy(blockedBy)
                .reasoning(text(node, "reasoning"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String systemPrompt(PromptContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are the navigation planner for a guided coaching session.\n");
        sb.append("You do not write the reply to the client. You choose what the coach attempts next.\n\n");
        sb.append("RULES:\n");
        sb.append("- Choose exactly one decision from: ").append(String.join(", ", context.getAllowedDecisions())).append(".\n");
        sb.append("- Body questions belong to the problem and body phase only.\n");
        sb.append("- Never ask how the client knows a feeling starts more than once.\n");
        sb.append("- Keep the client in the present moment; do not explore the past.\n\n");
        sb.append("Answer with a single JSON object and nothing else:\n");
        sb.append("{\"decision\": \"...\", \"situation_type\": \"...\", \"retrieval_tag\": \"...\", ");
        sb.append("\"ready_for_next\": false, \"blocked_by\": [\"...\"], \"reasoning\": \"...\"}\n");
        return sb.toString();
    }

    private static String userPrompt(PromptContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("STAGE: ").append(context.getStage()).append("\n");
        sb.append("SUBSTATE: ").append(context.getSubstate()).append("\n");
        sb.append("CLIENT SAID: \"").append(context.getUserText()).append("\"\n");
        sb.append("EMOTIONAL STATE: ").append(StringUtils.defaultString(context.getEmotionalState(), "unknown")).append("\n");
        sb.append("COMPLETION:\n");
        context.getCompletion().forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append("\n"));
        sb.append("COUNTERS:\n");
        context.getCounters().forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append("\n"));
        sb.append("RECENT EXCHANGES:\n");
        if (context.getRecentExchanges().isEmpty()) {
            sb.append("- none\n");
        }
        context.getRecentExchanges().forEach(e -> sb.append("- ").append(e).append("\n"));
        return sb.toString();
    }
}
