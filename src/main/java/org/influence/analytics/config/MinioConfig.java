package org.influence.analytics.config;

import io.minio.MinioClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "export.sink", havingValue = "minio", matchIfMissing = true)
public class MinioConfig {

    @Value("${export.minio.endpoint:http://localhost:9000}")
    private String endpoint;

    @Value("${export.minio.access-key:minioadmin}")
    private String accessKey;

    @Value("${export.minio.secret-key:minioadmin}")
    private String secretKey;

    @Bean
    public MinioClient minioClient() {
        return MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey)
                .build();
    }
}
