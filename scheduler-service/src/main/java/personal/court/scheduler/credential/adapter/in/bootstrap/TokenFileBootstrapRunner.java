package personal.court.scheduler.credential.adapter.in.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import personal.court.scheduler.config.CourtSchedulerProperties;
import personal.court.scheduler.credential.application.port.in.ManageCredentialUseCase;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 시작 시 tokens.json의 리프레시 토큰 등록
 * {"refresh_token": "..."}
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "court.bootstrap", name = "enabled", havingValue = "true")
public class TokenFileBootstrapRunner implements ApplicationRunner {

    private final ObjectMapper objectMapper;
    private final ManageCredentialUseCase manageCredentialUseCase;
    private final CourtSchedulerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        Path path = Path.of(properties.bootstrap().tokensPath());
        if (!Files.isRegularFile(path)) {
            log.warn("Tokens file not found, credentials must be supplied via API: path={}", path);
            return;
        }

        String refreshToken;
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            refreshToken = root.path("refresh_token").asText(null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read tokens file: " + path, e);
        }

        if (refreshToken == null || refreshToken.isBlank()) {
            log.error("No refresh_token in tokens file: path={}", path);
            return;
        }
        manageCredentialUseCase.bootstrap(refreshToken);
    }
}
