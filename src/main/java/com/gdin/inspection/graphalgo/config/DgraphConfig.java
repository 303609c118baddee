package com.gdin.inspection.graphalgo.config;

import com.gdin.inspection.graphalgo.config.properties.DgraphProperties;
import com.gdin.inspection.graphalgo.storage.DgraphConnection;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class DgraphConfig {
    @Resource
    private DgraphProperties dgraphProperties;

    /**
     * 连接串不合法时启动即失败。
     */
    @Bean
    public DgraphConnection dgraphConnection() {
        DgraphConnection connection = DgraphConnection.parse(dgraphProperties.getConnectionString());
        log.info("Dgraph 连接：{}", connection);
        return connection;
    }

    @Bean("dgraphRestTemplate")
    public RestTemplate dgraphRestTemplate(RestTemplateBuilder builder, DgraphConnection connection) {
        Duration timeout = Duration.ofSeconds(dgraphProperties.getTimeout());
        RestTemplateBuilder b = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout);
        if (connection.hasBearerToken()) {
            b = b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + connection.getBearerToken());
        } else if (connection.hasBasicAuth()) {
            b = b.basicAuthentication(connection.getUsername(), connection.getPassword());
        }
        return b.build();
    }
}
