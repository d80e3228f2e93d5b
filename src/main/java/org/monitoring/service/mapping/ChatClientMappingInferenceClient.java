package org.monitoring.service.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.exceptions.InferenceUnavailableException;
import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.ColumnClassification;
import org.monitoring.models.enums.MappingOrigin;
import org.monitoring.models.mapping.ColumnMapping;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.core.io.Resource;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks a chat model for a mapping. The model sees only header names and the sample rows.
 */
@Slf4j
public class ChatClientMappingInferenceClient implements MappingInferenceClient {

    private final ChatClient chatClient;
    private final Resource systemPromptResource;
    private final ObjectMapper objectMapper;

    public ChatClientMappingInferenceClient(ChatClient chatClient, Resource systemPromptResource, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.systemPromptResource = systemPromptResource;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "chat-model";
    }

    @Override
    public ColumnMapping propose(List<String> headers, List<Map<String, String>> sampleRows) {
        String userPrompt;
        try {
            userPrompt = String.format("""
                    Propose a column mapping for a dataset with these headers:
                    %s

                    Sample rows (at most %d), keyed by header:
                    %s
                    """, objectMapper.writeValueAsString(headers), sampleRows.size(),
                    objectMapper.writeValueAsString(sampleRows));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise inference input", e);
        }

        String answer;
        try {
            answer = chatClient.prompt()
                    .system(systemPromptResource)
                    .user(userPrompt)
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.warn("[inference] Chat model call failed: {}", ex.getMessage());
            throw new InferenceUnavailableException("Mapping inference model is unavailable: " + ex.getMessage(), ex);
        }
        return parse(answer);
    }

    ColumnMapping parse(String answer) {
        if (answer == null || answer.isBlank()) {
            throw new IllegalStateException("Model returned an empty answer");
        }
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalStateException("Model answer contains no JSON object");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(answer.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Model answer is not valid JSON: " + e.getOriginalMessage(), e);
        }

        ColumnMapping mapping = new ColumnMapping();
        mapping.setOrigin(MappingOrigin.INFERRED);

        JsonNode roles = root.path("roles");
        JsonNode confidence = root.path("confidence");
        for (CanonicalRole role : CanonicalRole.values()) {
            JsonNode column = roles.path(role.name());
            if (column.isTextual() && !column.asText().isBlank()) {
                mapping.assign(role, column.asText());
            }
            JsonNode score = confidence.path(role.name());
            mapping.getConfidence().put(role, score.isNumber() ? score.asDouble() : 0.0);
        }

        Iterator<Map.Entry<String, JsonNode>> classifications = root.path("classifications").fields();
        while (classifications.hasNext()) {
            Map.Entry<String, JsonNode> entry = classifications.next();
            ColumnClassification classification = toClassification(entry.getValue().asText());
            mapping.getClassifications().put(entry.getKey(), classification);
        }
        return mapping;
    }

    private ColumnClassification toClassification(String value) {
        try {
            return ColumnClassification.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknown) {
            return ColumnClassification.TEXT;
        }
    }
}
