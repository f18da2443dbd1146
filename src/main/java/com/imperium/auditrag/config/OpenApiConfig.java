package com.imperium.auditrag.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI auditRagOpenApi(@Value("${server.port:8001}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Audit RAG API")
                        .description("审计数据检索增强问答（RAG）服务接口文档：问答、原始检索、健康检查")
                        .version("v1")
                        .contact(new Contact().name("Audit RAG Team")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local")
                ));
    }
}
