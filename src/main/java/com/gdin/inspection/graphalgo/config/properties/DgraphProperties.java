package com.gdin.inspection.graphalgo.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.dgraph")
@Component
public class DgraphProperties implements Serializable {
    // dgraph://[user:password@]host[:port][?sslmode=require&bearertoken=xxx]，端口为 Dgraph 的 HTTP 端口
    private String connectionString = "dgraph://localhost:8080";
    // 查询/写入超时（秒）
    private Integer timeout = 30;
}
