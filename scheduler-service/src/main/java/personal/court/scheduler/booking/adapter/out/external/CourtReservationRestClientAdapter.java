package personal.court.scheduler.booking.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import personal.court.scheduler.booking.application.port.out.CourtReservationClient;
import personal.court.scheduler.booking.application.port.out.ReservationRequest;
import personal.court.scheduler.booking.domain.exception.DefinitiveRejectionException;
import personal.court.scheduler.booking.domain.exception.TransientExecutionException;
import personal.court.scheduler.credential.domain.exception.CredentialExpiredException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Court Reservation REST Client Adapter
 * 코트 예약 API와 HTTP 통신하는 구현체 (RestClient 사용)
 *
 * 응답 분류:
 * - 2xx: 접수
 * - 401: 토큰 거부 → CredentialExpiredException
 * - 429, 5xx, 연결/읽기 실패: TransientExecutionException (재시도 대상)
 * - 그 외 4xx: DefinitiveRejectionException (슬롯 없음, 요청 오류)
 */
@Slf4j
@Component
public class CourtReservationRestClientAdapter implements CourtReservationClient {

    // 예약 API는 offset에 콜론이 있는 형식을 사용 (2026-03-10T19:00:00-04:00)
    private static final DateTimeFormatter API_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    private final RestClient courtBookingRestClient;
    private final String reservationPath;
    private final String occupantId;

    public CourtReservationRestClientAdapter(RestClient courtBookingRestClient,
                                             @Value("${external.court-booking.reservation-path}") String reservationPath,
                                             @Value("${external.court-booking.occupant-id}") String occupantId) {
        this.courtBookingRestClient = courtBookingRestClient;
        this.reservationPath = reservationPath;
        this.occupantId = occupantId;
    }

    /**
     * 예약 제출
     * Circuit Breaker: 예약 API 장애가 이어지면 바로 일시적 실패로 응답 (재시도 예산 안에서 다시 시도됨)
     * 확정 거절은 ignoreExceptions로 등록되어 Circuit 실패로 세지 않음
     */
    @Override
    @CircuitBreaker(name = "courtBooking", fallbackMethod = "submitFallback")
    public void submit(ReservationRequest request, String accessToken) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amenity_type_id", "10");
        body.put("start_time", API_TIME_FORMAT.format(request.start()));
        body.put("amenity_id", String.valueOf(request.courtId().getAmenityId()));
        body.put("guests", "1");
        body.put("end_time", API_TIME_FORMAT.format(request.end()));
        body.put("amenity_reservation_type", "TR");

        log.debug("Submitting reservation: jobId={}, courtId={}, start={}",
                request.jobId(), request.courtId().getCode(), body.get("start_time"));

        try {
            courtBookingRestClient.post()
                    .uri(reservationPath, occupantId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        headers.setBearerAuth(accessToken);
                        headers.set("X-Correlation-Id", "booking_" + request.jobId());
                    })
                    .body(body)
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value(), (req, response) -> {
                        log.warn("Booking API rejected access token: jobId={}", request.jobId());
                        throw new CredentialExpiredException("Booking API rejected access token (401)");
                    })
                    .onStatus(CourtReservationRestClientAdapter::isTransient, (req, response) -> {
                        log.warn("Booking API temporarily unavailable: jobId={}, status={}",
                                request.jobId(), response.getStatusCode());
                        throw new TransientExecutionException("Booking API returned " + response.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is4xxClientError, (req, response) -> {
                        String reason = readBody(response.getBody());
                        log.warn("Booking rejected: jobId={}, status={}, body={}",
                                request.jobId(), response.getStatusCode(), reason);
                        throw new DefinitiveRejectionException(
                                String.format("Booking API returned %d: %s", response.getStatusCode().value(), reason));
                    })
                    .toBodilessEntity();
        } catch (ResourceAccessException e) {
            log.warn("Booking API unreachable: jobId={}, error={}", request.jobId(), e.getMessage());
            throw new TransientExecutionException("Booking API unreachable: " + e.getMessage(), e);
        }

        log.info("Reservation accepted: jobId={}, courtId={}, start={}",
                request.jobId(), request.courtId().getCode(), body.get("start_time"));
    }

    /**
     * Fallback 메서드
     * Circuit Open이면 예약 API를 호출하지 않고 일시적 실패로 처리
     * 도메인 예외는 분류가 이미 끝났으므로 그대로 전파
     */
    private void submitFallback(ReservationRequest request, String accessToken, Exception e) {
        if (e instanceof DefinitiveRejectionException rejection) {
            throw rejection;
        }
        if (e instanceof CredentialExpiredException expired) {
            throw expired;
        }
        if (e instanceof TransientExecutionException transientFailure) {
            throw transientFailure;
        }
        log.error("Booking circuit breaker opened: jobId={}, error={}",
                request.jobId(), e.getClass().getSimpleName(), e);
        throw new TransientExecutionException("Booking API circuit open: " + e.getClass().getSimpleName());
    }

    private static boolean isTransient(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }

    private static String readBody(InputStream body) {
        try {
            return StreamUtils.copyToString(body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable body: " + e.getMessage() + ">";
        }
    }
}
