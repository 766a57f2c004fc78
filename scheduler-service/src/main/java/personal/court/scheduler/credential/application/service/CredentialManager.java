package personal.court.scheduler.credential.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;
import personal.court.scheduler.booking.domain.exception.TransientExecutionException;
import personal.court.scheduler.config.CourtSchedulerProperties;
import personal.court.scheduler.credential.application.port.in.GetAccessTokenUseCase;
import personal.court.scheduler.credential.application.port.in.GetCredentialHealthUseCase;
import personal.court.scheduler.credential.application.port.in.ManageCredentialUseCase;
import personal.court.scheduler.credential.application.port.out.CredentialRepository;
import personal.court.scheduler.credential.application.port.out.TokenRefreshClient;
import personal.court.scheduler.credential.domain.exception.CredentialExpiredException;
import personal.court.scheduler.credential.domain.model.AlertLevel;
import personal.court.scheduler.credential.domain.model.Credential;
import personal.court.scheduler.credential.domain.model.CredentialHealth;
import personal.court.scheduler.credential.domain.model.TokenGrant;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Credential Manager
 * 액세스 토큰 발급과 갱신을 전담
 *
 * Single-flight 갱신:
 * - 동시에 여러 실행이 토큰을 요청해도 인증 서버 호출은 한 번만 나간다.
 * - 먼저 들어온 호출자가 갱신을 수행하고 나머지는 같은 CompletableFuture를 기다린다.
 * - 대기는 acquireTimeout으로 제한되며 초과 시 일시적 실패로 처리된다.
 * - 저장된 자격 증명의 교체(운영자 교체, 액세스 토큰 폐기)는 진행 중인 갱신이 없을 때만 refreshLock 안에서 일어난다.
 */
@Slf4j
@Service
public class CredentialManager implements GetAccessTokenUseCase, ManageCredentialUseCase, GetCredentialHealthUseCase {

    private final CredentialRepository credentialRepository;
    private final TokenRefreshClient tokenRefreshClient;
    private final Clock clock;
    private final CourtSchedulerProperties.Credential settings;

    private final AtomicReference<Credential> cache = new AtomicReference<>();
    private final Object refreshLock = new Object();
    private CompletableFuture<Credential> inFlight;

    private volatile Instant lastRefreshAttemptAt;
    private volatile String lastRefreshError;
    private volatile boolean refreshRejected;
    private volatile String accessTokenRejection;

    public CredentialManager(CredentialRepository credentialRepository,
                             TokenRefreshClient tokenRefreshClient,
                             Clock clock,
                             CourtSchedulerProperties properties) {
        this.credentialRepository = credentialRepository;
        this.tokenRefreshClient = tokenRefreshClient;
        this.clock = clock;
        this.settings = properties.credential();
    }

    @Override
    public String getValidAccessToken() {
        Credential credential = current();
        if (credential != null && credential.isAccessValidFor(clock.instant(), settings.safetyMargin())) {
            return credential.accessToken();
        }
        return awaitRefresh(settings.safetyMargin()).accessToken();
    }

    @Override
    public boolean refreshIfExpiringSoon() {
        Credential credential = current();
        if (credential == null || !credential.hasRefreshToken()) {
            log.warn("Skipping proactive refresh: no refresh token configured");
            return false;
        }
        if (credential.isAccessValidFor(clock.instant(), settings.proactiveWindow())) {
            log.debug("Access token still valid beyond proactive window: accessExpiry={}", credential.accessExpiry());
            return false;
        }
        awaitRefresh(settings.proactiveWindow());
        return true;
    }

    @Override
    public void bootstrap(String refreshToken) {
        requireToken(refreshToken);
        Credential existing = credentialRepository.load().orElse(null);

        // 저장된 토큰이 살아 있으면 그대로 사용 (갱신 과정에서 이미 교체되었을 수 있음)
        if (existing != null && existing.hasRefreshToken() && !existing.isRefreshExpired(clock.instant())) {
            log.info("Stored credential kept, bootstrap token ignored: refreshExpiry={}", existing.refreshExpiry());
            cache.set(existing);
            return;
        }

        Credential seeded = existing == null
                ? Credential.bootstrap(refreshToken.trim())
                : existing.withRefreshToken(refreshToken.trim());
        cache.set(credentialRepository.save(seeded));
        refreshRejected = false;
        accessTokenRejection = null;
        log.info("Refresh token bootstrapped");
    }

    @Override
    public CredentialHealth rotate(String refreshToken) {
        requireToken(refreshToken);
        String trimmed = refreshToken.trim();

        // 진행 중인 갱신이 끝난 뒤에 교체해야 이전 토큰으로 받은 결과가 운영자 토큰을 덮어쓰지 않는다
        while (true) {
            CompletableFuture<Credential> running;
            synchronized (refreshLock) {
                running = inFlight;
                if (running == null) {
                    Credential existing = current();
                    Credential rotated = existing == null
                            ? Credential.bootstrap(trimmed)
                            : existing.withRefreshToken(trimmed);
                    cache.set(credentialRepository.save(rotated));
                    refreshRejected = false;
                    lastRefreshError = null;
                    accessTokenRejection = null;
                    break;
                }
            }
            log.info("Waiting for in-flight token refresh before rotating refresh token");
            awaitCompletion(running);
        }
        log.info("Refresh token rotated by operator, refreshing immediately");

        awaitRefresh(settings.safetyMargin());
        return health();
    }

    @Override
    public void invalidateAccessToken(String accessToken, String reason) {
        accessTokenRejection = reason;
        synchronized (refreshLock) {
            Credential credential = current();
            // 이미 다른 토큰으로 바뀌었거나 갱신 중이면 그 결과를 그대로 쓴다
            if (inFlight == null && credential != null && credential.hasAccessToken()
                    && credential.accessToken().equals(accessToken)) {
                cache.set(credentialRepository.save(credential.withoutAccessToken()));
                log.error("Access token rejected by booking API, dropped cached token: reason={}", reason);
                return;
            }
        }
        log.error("Access token rejected by booking API: reason={}", reason);
    }

    @Override
    public void confirmAccessToken() {
        if (accessTokenRejection != null) {
            log.info("Booking API accepted access token, clearing rejection: previous={}", accessTokenRejection);
            accessTokenRejection = null;
        }
    }

    @Override
    public CredentialHealth health() {
        Instant now = clock.instant();
        Credential credential = current();
        List<String> reasons = new ArrayList<>();
        AlertLevel level = AlertLevel.HEALTHY;

        boolean hasRefresh = credential != null && credential.hasRefreshToken();
        boolean refreshExpired = credential != null && credential.isRefreshExpired(now);

        if (!hasRefresh) {
            level = AlertLevel.CRITICAL;
            reasons.add("No refresh token configured");
        } else if (refreshExpired) {
            level = AlertLevel.CRITICAL;
            reasons.add("Refresh token expired at " + credential.refreshExpiry());
        } else if (refreshRejected) {
            level = AlertLevel.CRITICAL;
            reasons.add("Refresh token rejected by auth server: " + lastRefreshError);
        } else if (accessTokenRejection != null) {
            level = AlertLevel.CRITICAL;
            reasons.add("Access token rejected by booking API: " + accessTokenRejection);
        } else if (credential.refreshExpiry() != null
                && credential.refreshExpiry().isBefore(now.plus(settings.expiryWarning()))) {
            level = AlertLevel.WARNING;
            reasons.add(String.format(Locale.ROOT, "Refresh token expires in %.1f days", daysUntil(now, credential.refreshExpiry())));
        }

        boolean hasAccess = credential != null && credential.hasAccessToken();
        boolean accessValid = credential != null && credential.isAccessValidFor(now, Duration.ZERO);
        if (hasAccess && !accessValid) {
            level = level.max(AlertLevel.WARNING);
            reasons.add("Access token expired at " + credential.accessExpiry());
        }

        Instant accessExpiry = credential == null ? null : credential.accessExpiry();
        Instant refreshExpiry = credential == null ? null : credential.refreshExpiry();
        return new CredentialHealth(
                level,
                hasAccess,
                accessValid,
                accessExpiry,
                accessExpiry == null ? null : Duration.between(now, accessExpiry).getSeconds(),
                hasRefresh,
                refreshExpired,
                refreshRejected,
                refreshExpiry,
                refreshExpiry == null ? null : Math.round(daysUntil(now, refreshExpiry) * 100) / 100.0,
                credential == null ? null : credential.lastRefreshAt(),
                lastRefreshAttemptAt,
                lastRefreshError,
                accessTokenRejection,
                List.copyOf(reasons));
    }

    /**
     * 진행 중인 갱신에 합류하거나 직접 갱신을 시작
     */
    private Credential awaitRefresh(Duration minValidity) {
        CompletableFuture<Credential> future;
        boolean leader = false;
        synchronized (refreshLock) {
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
            }
            future = inFlight;
        }

        if (leader) {
            try {
                future.complete(doRefresh(minValidity));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } finally {
                synchronized (refreshLock) {
                    inFlight = null;
                }
            }
        }

        try {
            return future.get(settings.acquireTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for token refresh: timeout={}", settings.acquireTimeout());
            throw new TransientExecutionException(ErrorCode.CREDENTIAL_UNAVAILABLE,
                    "Timed out waiting for token refresh after " + settings.acquireTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExecutionException(ErrorCode.CREDENTIAL_UNAVAILABLE,
                    "Interrupted while waiting for token refresh");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TransientExecutionException("Token refresh failed", e.getCause());
        }
    }

    /**
     * 다른 호출자의 갱신이 끝날 때까지 대기 (결과는 각자의 호출자가 처리)
     */
    private void awaitCompletion(CompletableFuture<Credential> running) {
        try {
            running.get(settings.acquireTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            log.debug("In-flight token refresh finished with error: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            throw new TransientExecutionException(ErrorCode.CREDENTIAL_UNAVAILABLE,
                    "Timed out waiting for in-flight token refresh after " + settings.acquireTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExecutionException(ErrorCode.CREDENTIAL_UNAVAILABLE,
                    "Interrupted while waiting for in-flight token refresh");
        }
    }

    private Credential doRefresh(Duration minValidity) {
        Instant now = clock.instant();
        Credential credential = current();

        // 기다리는 동안 다른 갱신이 이미 끝났을 수 있음
        if (credential != null && credential.isAccessValidFor(now, minValidity)) {
            return credential;
        }
        if (credential == null || !credential.hasRefreshToken()) {
            throw rejected("No refresh token configured; supply tokens.json or rotate the refresh token");
        }
        if (credential.isRefreshExpired(now)) {
            throw rejected("Refresh token expired at " + credential.refreshExpiry() + "; rotate the refresh token");
        }

        lastRefreshAttemptAt = now;
        log.info("Refreshing access token: accessExpiry={}, refreshExpiry={}",
                credential.accessExpiry(), credential.refreshExpiry());
        try {
            TokenGrant grant = tokenRefreshClient.refresh(credential.refreshToken());
            Credential refreshed = credentialRepository.save(credential.withGrant(grant, clock.instant()));
            cache.set(refreshed);
            lastRefreshError = null;
            refreshRejected = false;
            log.info("Access token refreshed: accessExpiry={}, refreshExpiry={}",
                    refreshed.accessExpiry(), refreshed.refreshExpiry());
            return refreshed;
        } catch (CredentialExpiredException e) {
            lastRefreshError = e.getMessage();
            refreshRejected = true;
            log.error("Refresh token rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            lastRefreshError = e.getMessage();
            log.warn("Token refresh failed: error={}", e.getMessage());
            throw e;
        }
    }

    private CredentialExpiredException rejected(String message) {
        lastRefreshError = message;
        refreshRejected = true;
        log.error("Cannot refresh access token: {}", message);
        return new CredentialExpiredException(message);
    }

    private Credential current() {
        Credential cached = cache.get();
        if (cached != null) {
            return cached;
        }
        return credentialRepository.load()
                .map(loaded -> {
                    cache.compareAndSet(null, loaded);
                    return cache.get();
                })
                .orElse(null);
    }

    private static void requireToken(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Refresh token cannot be blank");
        }
    }

    private static double daysUntil(Instant now, Instant target) {
        return Duration.between(now, target).toSeconds() / 86_400.0;
    }
}
