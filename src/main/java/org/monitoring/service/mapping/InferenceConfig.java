package org.monitoring.service.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.configuration.MonitoringProperties;
import org.monitoring.service.etl.TimestampParser;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Chooses the inference capability. A {@link ChatModel} bean appears when a Spring AI model
 * starter is on the classpath and configured; otherwise the heuristic proposer is used.
 */
@Slf4j
@Configuration
public class InferenceConfig {

    @Value("classpath:prompts/column-mapping-system.st")
    private Resource systemPromptResource;

    @Bean
    public MappingInferenceClient mappingInferenceClient(ObjectProvider<ChatModel> chatModelProvider,
                                                         MonitoringProperties properties,
                                                         ObjectMapper objectMapper,
                                                         TimestampParser timestampParser) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        boolean heuristicOnly = "heuristic".equalsIgnoreCase(properties.getInference().getProvider());
        if (chatModel != null && !heuristicOnly) {
            log.info("[inference] Using chat model {} for mapping inference", chatModel.getClass().getSimpleName());
            return new ChatClientMappingInferenceClient(ChatClient.builder(chatModel).build(), systemPromptResource, objectMapper);
        }
        log.info("[inference] No chat model configured, using heuristic mapping inference");
        return new HeuristicMappingInferenceClient(timestampParser);
    }
}
