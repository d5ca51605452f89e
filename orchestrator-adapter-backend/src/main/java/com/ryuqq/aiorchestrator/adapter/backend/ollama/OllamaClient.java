package com.ryuqq.aiorchestrator.adapter.backend.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Ollama HTTP API 클라이언트.
 *
 * <p>모든 Ollama 어댑터가 공유하며, 전송 오류를 {@link AdapterException}으로 분류합니다.</p>
 *
 * <ul>
 *   <li>연결 실패, 타임아웃, 5xx, 429: TRANSIENT</li>
 *   <li>그 외 4xx: PERMANENT</li>
 *   <li>응답 JSON 해석 실패: MALFORMED_RESPONSE</li>
 * </ul>
 *
 * <p>연결이 거부되면 reconnectDelayMs 대기 후 한 번만 다시 연결합니다.
 * 오케스트레이터는 이 재연결을 알지 못합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OllamaClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    static final String TAGS_PATH = "/api/tags";

    private final OllamaConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public OllamaClient() {
        this(new OllamaConfig());
    }

    public OllamaClient(OllamaConfig config) {
        this(config, HttpClient.newBuilder()
            .connectTimeout(requireConfig(config).connectTimeout())
            .build());
    }

    /**
     * 생성자 (HttpClient 주입).
     *
     * @param config 연결 설정
     * @param httpClient HTTP 클라이언트
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OllamaClient(OllamaConfig config, HttpClient httpClient) {
        requireConfig(config);
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OllamaConfig requireConfig(OllamaConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    /**
     * JSON 요청 전송 및 응답 역직렬화.
     *
     * @param path API 경로 (예: /api/chat)
     * @param body 요청 DTO
     * @param responseType 응답 DTO 타입
     * @return 역직렬화된 응답
     * @throws AdapterException 전송 실패, 오류 상태 코드, 응답 해석 실패
     */
    public <T> T post(String path, Object body, Class<T> responseType) throws AdapterException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw AdapterException.permanentFailure("cannot serialize request for " + path, e);
        }
        HttpRequest request = HttpRequest.newBuilder(uri(path))
            .header("Content-Type", "application/json")
            .timeout(config.requestTimeout())
            .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response = send(request);
        int status = response.statusCode();
        if (status >= 500 || status == 429) {
            throw AdapterException.transientFailure(
                "Ollama " + path + " returned " + status + ": " + abbreviate(response.body()), null);
        }
        if (status != 200) {
            throw AdapterException.permanentFailure(
                "Ollama " + path + " returned " + status + ": " + abbreviate(response.body()), null);
        }

        String responseBody = response.body();
        if (responseBody == null || responseBody.isBlank()) {
            throw AdapterException.malformedResponse("Ollama " + path + " returned an empty body", null);
        }
        T parsed;
        try {
            parsed = mapper.readValue(responseBody, responseType);
        } catch (JsonProcessingException e) {
            throw AdapterException.malformedResponse("cannot parse Ollama " + path + " response", e);
        }
        if (parsed == null) {
            throw AdapterException.malformedResponse("Ollama " + path + " returned a null document", null);
        }
        return parsed;
    }

    /**
     * 서버 생존 확인 (GET /api/tags).
     *
     * @return 200 응답이면 true
     */
    public boolean ping() {
        HttpRequest request = HttpRequest.newBuilder(uri(TAGS_PATH))
            .timeout(config.connectTimeout())
            .GET()
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama ping to {} failed: {}", config.baseUrl(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * JSON 문자열을 지정 타입으로 해석 (format=json 응답 본문용).
     *
     * @throws AdapterException 해석 실패 또는 null 문서인 경우 MALFORMED_RESPONSE
     */
    public <T> T readJson(String json, Class<T> type) throws AdapterException {
        if (json == null || json.isBlank()) {
            throw AdapterException.malformedResponse("expected a JSON document but got an empty response", null);
        }
        T parsed;
        try {
            parsed = mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw AdapterException.malformedResponse("model did not return valid JSON", e);
        }
        if (parsed == null) {
            throw AdapterException.malformedResponse("model returned a null JSON document", null);
        }
        return parsed;
    }

    public OllamaConfig config() {
        return config;
    }

    private HttpResponse<String> send(HttpRequest request) throws AdapterException {
        try {
            try {
                return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (ConnectException e) {
                log.warn("Connection to {} refused, reconnecting once", config.baseUrl());
                pauseBeforeReconnect();
                return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            }
        } catch (HttpTimeoutException e) {
            throw AdapterException.transientFailure(
                "Ollama request timed out after " + config.requestTimeoutMs() + " ms", e);
        } catch (IOException e) {
            throw AdapterException.transientFailure("Ollama not reachable at " + config.baseUrl(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AdapterException.transientFailure("Ollama request interrupted", e);
        }
    }

    private void pauseBeforeReconnect() throws InterruptedException {
        if (config.reconnectDelayMs() > 0) {
            Thread.sleep(config.reconnectDelayMs());
        }
    }

    private URI uri(String path) {
        return URI.create(config.baseUrl() + path);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
