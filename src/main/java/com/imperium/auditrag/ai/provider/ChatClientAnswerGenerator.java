package com.imperium.auditrag.ai.provider;

import com.imperium.auditrag.exception.GenerationTimeoutException;
import com.imperium.auditrag.exception.GenerationUnavailableException;
import com.imperium.auditrag.support.TimedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * 通过 Spring AI {@link ChatClient} 调用 OpenAI 兼容端点（OpenAI / DeepSeek / Ollama /v1）。
 * <p>
 * 同步调用放到生成专用线程池中执行，超过 {@code app.llm.timeout} 即放弃等待并抛出 {@link GenerationTimeoutException}。
 */
@Component
public class ChatClientAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAnswerGenerator.class);

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final Duration timeout;
    private final String healthUrl;
    private final RestTemplate healthRestTemplate;

    public ChatClientAnswerGenerator(ChatClient chatClient,
            @Qualifier("generationCallExecutor") ExecutorService executor,
            @Value("${app.llm.timeout:120s}") Duration timeout,
            @Value("${app.llm.health-url:}") String healthUrl) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.timeout = timeout;
        this.healthUrl = healthUrl;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(HEALTH_TIMEOUT);
        requestFactory.setReadTimeout(HEALTH_TIMEOUT);
        this.healthRestTemplate = new RestTemplate(requestFactory);
    }

    @Override
    public String generate(String prompt, int maxTokens, double temperature)
            throws GenerationTimeoutException, GenerationUnavailableException {
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
        String content;
        try {
            content = TimedCall.call(executor,
                    () -> chatClient.prompt()
                            .user(prompt)
                            .options(options)
                            .call()
                            .content(),
                    timeout);
        } catch (TimeoutException e) {
            log.error("LLM request timed out after {}", TimedCall.describe(timeout));
            throw new GenerationTimeoutException("LLM request timed out after " + TimedCall.describe(timeout), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("LLM request failed: {}", cause.getMessage());
            throw new GenerationUnavailableException("LLM request failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationUnavailableException("LLM request interrupted", e);
        }
        if (content == null) {
            log.warn("Unexpected LLM response format: no text content");
            throw new GenerationUnavailableException("LLM response contained no text content");
        }
        return content;
    }

    @Override
    public boolean isAvailable() {
        if (healthUrl == null || healthUrl.isBlank()) {
            return false;
        }
        try {
            ResponseEntity<String> response = healthRestTemplate.getForEntity(healthUrl, String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (Exception e) {
            log.warn("LLM endpoint not available at {}: {}", healthUrl, e.getMessage());
            return false;
        }
    }
}
