package com.imperium.auditrag.config;

import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Qdrant 连接配置。
 * <p>
 * 不在启动时直接创建 {@link QdrantClient}：Qdrant 不可达时应用仍需正常启动，
 * 由 {@code QdrantVectorStoreGateway} 在首次检索时懒加载，断线后按需重建。
 * 这里只注册一个「每次调用都新建 client」的工厂。
 */
@Configuration
public class VectorStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreConfig.class);

    @Value("${app.qdrant.host:localhost}")
    private String qdrantHost;

    @Value("${app.qdrant.port:6334}")
    private int qdrantPort;

    @Value("${app.qdrant.use-tls:false}")
    private boolean useTls;

    @Value("${app.qdrant.api-key:}")
    private String apiKey;

    @Bean
    public Supplier<QdrantClient> qdrantClientFactory() {
        return () -> {
            log.info("Creating Qdrant client: {}:{} (tls={})", qdrantHost, qdrantPort, useTls);
            QdrantGrpcClient.Builder grpc = QdrantGrpcClient.newBuilder(qdrantHost, qdrantPort, useTls);
            if (apiKey != null && !apiKey.isBlank()) {
                grpc.withApiKey(apiKey);
            }
            return new QdrantClient(grpc.build());
        };
    }
}
