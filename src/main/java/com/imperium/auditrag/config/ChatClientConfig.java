package com.imperium.auditrag.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提供 {@link ChatClient} bean。
 * spring-ai-starter-model-openai 会自动配置 ChatModel 和 ChatClient.Builder，
 * 这里统一挂上审计助手的系统提示；上下文与问题由 ContextBuilder 拼好后作为 user 消息传入。
 */
@Configuration
public class ChatClientConfig {

    static final String AUDIT_ASSISTANT_SYSTEM_PROMPT = "You are an expert AI Audit Assistant. "
            + "Provide accurate, helpful responses based ONLY on the audit data provided in the context. "
            + "If the answer is not in the context, say 'I don't know'.";

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder
                .defaultSystem(AUDIT_ASSISTANT_SYSTEM_PROMPT)
                .build();
    }
}
