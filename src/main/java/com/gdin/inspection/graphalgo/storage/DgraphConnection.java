package com.gdin.inspection.graphalgo.storage;

import cn.hutool.core.util.StrUtil;
import cn.hutool.core.util.URLUtil;
import cn.hutool.http.HttpUtil;
import lombok.Builder;
import lombok.Value;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * dgraph:// 连接串：{@code dgraph://[user:password@]host[:port][?sslmode=...&bearertoken=...]}。
 *
 * 走 Dgraph 的 HTTP 接口，端口缺省 8080；sslmode 为 require / verify-ca / verify-full 时用 https。
 */
@Value
@Builder
public class DgraphConnection {

    public static final String SCHEME = "dgraph://";

    public static final int DEFAULT_PORT = 8080;

    private static final Set<String> SECURE_MODES = Set.of("require", "verify-ca", "verify-full");

    String host;

    int port;

    String username;

    String password;

    String sslMode;

    String bearerToken;

    public static DgraphConnection parse(String connectionString) {
        if (StrUtil.isBlank(connectionString) || !connectionString.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Connection string must start with 'dgraph://'");
        }

        URI uri;
        try {
            uri = URI.create(connectionString);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed dgraph connection string", e);
        }

        String username = null;
        String password = null;
        String userInfo = uri.getUserInfo();
        if (StrUtil.isNotEmpty(userInfo)) {
            int idx = userInfo.indexOf(':');
            username = idx < 0 ? userInfo : userInfo.substring(0, idx);
            password = idx < 0 ? null : userInfo.substring(idx + 1);
        }

        Map<String, List<String>> params = StrUtil.isBlank(uri.getRawQuery())
                ? Map.of()
                : HttpUtil.decodeParams(uri.getRawQuery(), StandardCharsets.UTF_8);

        return DgraphConnection.builder()
                .host(StrUtil.blankToDefault(uri.getHost(), "localhost"))
                .port(uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT)
                .username(username == null ? null : URLUtil.decode(username))
                .password(password == null ? null : URLUtil.decode(password))
                .sslMode(first(params, "sslmode", "disable"))
                .bearerToken(first(params, "bearertoken", null))
                .build();
    }

    private static String first(Map<String, List<String>> params, String key, String defaultValue) {
        List<String> values = params.get(key);
        if (values == null || values.isEmpty() || StrUtil.isBlank(values.get(0))) return defaultValue;
        return values.get(0);
    }

    public boolean isSecure() {
        return SECURE_MODES.contains(sslMode);
    }

    public boolean hasBearerToken() {
        return StrUtil.isNotBlank(bearerToken);
    }

    public boolean hasBasicAuth() {
        return StrUtil.isNotBlank(username) && password != null;
    }

    public String baseUrl() {
        return (isSecure() ? "https" : "http") + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        // 不输出口令和 token
        return "DgraphConnection{" + baseUrl() + ", sslMode=" + sslMode
                + ", bearerToken=" + hasBearerToken() + ", basicAuth=" + hasBasicAuth() + "}";
    }
}
