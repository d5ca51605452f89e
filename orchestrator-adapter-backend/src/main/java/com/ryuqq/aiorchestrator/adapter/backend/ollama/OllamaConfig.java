package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import java.time.Duration;

/**
 * Ollama 연결 설정.
 *
 * <p>불변 객체이며, 변경이 필요하면 withX 메서드로 새 인스턴스를 생성합니다.</p>
 *
 * @param baseUrl Ollama 서버 주소 (끝의 '/' 제거)
 * @param connectTimeoutMs 연결 타임아웃 (밀리초)
 * @param requestTimeoutMs 요청 타임아웃 (밀리초)
 * @param reconnectDelayMs 연결 거부 후 재연결 전 대기 시간 (밀리초, 0 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OllamaConfig(
    String baseUrl,
    long connectTimeoutMs,
    long requestTimeoutMs,
    long reconnectDelayMs
) {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: baseUrl=http://localhost:11434, connectTimeoutMs=10000ms,
     * requestTimeoutMs=120000ms, reconnectDelayMs=200ms</p>
     */
    public OllamaConfig() {
        this(DEFAULT_BASE_URL, 10000, 120000, 200);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OllamaConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        baseUrl = baseUrl.trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")"
            );
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")"
            );
        }
        if (reconnectDelayMs < 0) {
            throw new IllegalArgumentException(
                "reconnectDelayMs must be non-negative (current: " + reconnectDelayMs + ")"
            );
        }
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public OllamaConfig withBaseUrl(String baseUrl) {
        return new OllamaConfig(baseUrl, connectTimeoutMs, requestTimeoutMs, reconnectDelayMs);
    }

    public OllamaConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new OllamaConfig(baseUrl, connectTimeoutMs, requestTimeoutMs, reconnectDelayMs);
    }

    public OllamaConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new OllamaConfig(baseUrl, connectTimeoutMs, requestTimeoutMs, reconnectDelayMs);
    }

    public OllamaConfig withReconnectDelayMs(long reconnectDelayMs) {
        return new OllamaConfig(baseUrl, connectTimeoutMs, requestTimeoutMs, reconnectDelayMs);
    }
}
