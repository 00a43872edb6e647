package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class AiProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(AiProviderConfig.class);

    @Bean
    public StubAiProvider getStubAiProvider() {
        return new StubAiProvider();
    }

    // The remote provider is used only when an API key is configured
    @Bean
    @Primary
    public AiProvider getAiProvider(StubAiProvider stubAiProvider,
                                    RestClient.Builder restClientBuilder,
                                    ObjectMapper objectMapper,
                                    @Value("${vocab.ai.openai.apiKey:}") String apiKey,
                                    @Value("${vocab.ai.openai.endpoint:https://api.openai.com}") String endpoint,
                                    @Value("${vocab.ai.openai.model:gpt-4.1-mini}") String model,
                                    @Value("${vocab.ai.openai.timeoutSeconds:30}") int timeoutSeconds) {
        if (apiKey == null || apiKey.isBlank()) {
            log.info("No OpenAI API key configured, using the {} content provider", stubAiProvider.providerName());
            return stubAiProvider;
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(timeoutSeconds));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));

        RestClient restClient = restClientBuilder
                .baseUrl(endpoint)
                .requestFactory(requestFactory)
                .build();

        log.info("Using OpenAI content provider with model {}", model);
        return new OpenAiProvider(restClient, objectMapper, apiKey, model);
    }
}
