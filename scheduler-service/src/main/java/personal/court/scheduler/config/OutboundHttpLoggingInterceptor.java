package personal.court.scheduler.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Outbound HTTP Logging Interceptor
 * 외부 API 호출 1건을 operation, correlationId, 소요 시간, 상태 코드와 함께 한 줄로 기록
 *
 * 보안: 토큰과 비밀 값은 앞 8자만 남기거나 [REDACTED]로 가린다.
 * - Authorization: Bearer 토큰은 앞 8자만 노출
 * - x-api-key, cookie, set-cookie 헤더: [REDACTED]
 * - JSON/form 본문의 refresh_token, access_token, password, secret 필드
 *
 * 로그 레벨: 연결 실패 ERROR, 4xx/5xx WARN, 그 외 INFO
 */
@Slf4j
public class OutboundHttpLoggingInterceptor implements ClientHttpRequestInterceptor {

    static final String CORRELATION_HEADER = "X-Correlation-Id";
    static final String REDACTED = "[REDACTED]";

    private static final Set<String> SECRET_HEADERS = Set.of("x-api-key", "cookie", "set-cookie");
    private static final Set<String> SECRET_FIELDS = Set.of("refresh_token", "access_token", "password", "secret");
    private static final int VISIBLE_PREFIX = 8;

    private final String operation;
    private final ObjectMapper objectMapper;

    public OutboundHttpLoggingInterceptor(String operation, ObjectMapper objectMapper) {
        this.operation = operation;
        this.objectMapper = objectMapper;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        String correlationId = request.getHeaders().getFirst(CORRELATION_HEADER);
        if (correlationId == null) {
            correlationId = UUID.randomUUID().toString().substring(0, 8);
        }
        long startNanos = System.nanoTime();

        try {
            ClientHttpResponse response = execution.execute(request, body);
            int status = response.getStatusCode().value();
            String duration = elapsed(startNanos);
            if (status >= 400) {
                log.warn("HTTP {} {} returned {} ({}ms): operation={}, correlationId={}, headers={}, body={}",
                        request.getMethod(), request.getURI(), status, duration, operation, correlationId,
                        sanitizeHeaders(request.getHeaders()), sanitizeBody(request.getHeaders().getContentType(), body));
            } else {
                log.info("HTTP {} {} returned {} ({}ms): operation={}, correlationId={}, headers={}, body={}",
                        request.getMethod(), request.getURI(), status, duration, operation, correlationId,
                        sanitizeHeaders(request.getHeaders()), sanitizeBody(request.getHeaders().getContentType(), body));
            }
            return response;
        } catch (IOException e) {
            log.error("HTTP {} {} failed ({}ms): operation={}, correlationId={}, errorType={}, error={}, headers={}, body={}",
                    request.getMethod(), request.getURI(), elapsed(startNanos), operation, correlationId,
                    e.getClass().getSimpleName(), e.getMessage(),
                    sanitizeHeaders(request.getHeaders()), sanitizeBody(request.getHeaders().getContentType(), body));
            throw e;
        }
    }

    Map<String, String> sanitizeHeaders(HttpHeaders headers) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String value = String.join(",", values);
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.equals("authorization")) {
                value = value.startsWith("Bearer ") ? "Bearer " + mask(value.substring(7)) : REDACTED;
            } else if (SECRET_HEADERS.contains(lower)) {
                value = REDACTED;
            }
            sanitized.put(name, value);
        });
        return sanitized;
    }

    String sanitizeBody(MediaType contentType, byte[] body) {
        if (body == null || body.length == 0) {
            return "";
        }
        String text = new String(body, StandardCharsets.UTF_8);
        if (contentType != null && contentType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
            return sanitizeJson(text, body.length);
        }
        if (contentType != null && contentType.isCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED)) {
            return sanitizeForm(text);
        }
        return "[" + body.length + " bytes]";
    }

    private String sanitizeJson(String text, int length) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node instanceof ObjectNode object) {
                for (String field : SECRET_FIELDS) {
                    JsonNode value = object.get(field);
                    if (value != null) {
                        object.put(field, value.isTextual() ? mask(value.asText()) : REDACTED);
                    }
                }
            }
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return "[unparseable JSON, " + length + " bytes]";
        }
    }

    private static String sanitizeForm(String text) {
        List<String> pairs = new ArrayList<>();
        for (String pair : text.split("&")) {
            int separator = pair.indexOf('=');
            if (separator < 0) {
                pairs.add(pair);
                continue;
            }
            String name = URLDecoder.decode(pair.substring(0, separator), StandardCharsets.UTF_8);
            if (SECRET_FIELDS.contains(name)) {
                String value = URLDecoder.decode(pair.substring(separator + 1), StandardCharsets.UTF_8);
                pairs.add(name + "=" + mask(value));
            } else {
                pairs.add(pair);
            }
        }
        return String.join("&", pairs);
    }

    /**
     * 8자를 넘으면 앞 8자만 남기고, 그 이하면 전부 가린다.
     */
    static String mask(String secret) {
        if (secret == null || secret.length() <= VISIBLE_PREFIX) {
            return REDACTED;
        }
        return secret.substring(0, VISIBLE_PREFIX) + "...";
    }

    private static String elapsed(long startNanos) {
        return String.format(Locale.ROOT, "%.1f", (System.nanoTime() - startNanos) / 1_000_000.0);
    }
}
