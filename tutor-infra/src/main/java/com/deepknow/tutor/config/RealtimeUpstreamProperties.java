package com.deepknow.tutor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.upstream")
public class RealtimeUpstreamProperties {
    public enum CredentialMode { HEADER, SUBPROTOCOL }

    private String url = "wss://api.openai.com/v1/realtime";
    private String model = "gpt-realtime-mini-2025-12-15";
    private String apiKeyEnv = "OPENAI_API_KEY";
    private String apiKey; // 直接配置的密钥（优先级高于 apiKeyEnv）
    private CredentialMode credentialMode = CredentialMode.HEADER;
    private int handshakeTimeoutMillis = 15000;
    private int maxMessageBytes = 4 * 1024 * 1024;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public CredentialMode getCredentialMode() { return credentialMode; }
    public void setCredentialMode(CredentialMode credentialMode) { this.credentialMode = credentialMode; }
    public int getHandshakeTimeoutMillis() { return handshakeTimeoutMillis; }
    public void setHandshakeTimeoutMillis(int handshakeTimeoutMillis) { this.handshakeTimeoutMillis = handshakeTimeoutMillis; }
    public int getMaxMessageBytes() { return maxMessageBytes; }
    public void setMaxMessageBytes(int maxMessageBytes) { this.maxMessageBytes = maxMessageBytes; }

    /**
     * 解析最终密钥：显式配置优先，否则读取 apiKeyEnv 指向的环境变量。
     */
    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isEmpty()) return apiKey;
        return apiKeyEnv == null ? null : System.getenv(apiKeyEnv);
    }
}
