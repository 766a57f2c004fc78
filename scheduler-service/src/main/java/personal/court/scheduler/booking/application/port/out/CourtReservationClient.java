package personal.court.scheduler.booking.application.port.out;

/**
 * Court Reservation Client (Output Port)
 * 원격 코트 예약 API
 */
public interface CourtReservationClient {

    /**
     * 예약 제출. 정상 반환이면 접수된 것으로 본다.
     *
     * @throws personal.court.scheduler.booking.domain.exception.DefinitiveRejectionException 슬롯 없음 등 확정 거절
     * @throws personal.court.scheduler.booking.domain.exception.TransientExecutionException  네트워크 오류, 5xx, 429
     * @throws personal.court.scheduler.credential.domain.exception.CredentialExpiredException 토큰 거부 (401)
     */
    void submit(ReservationRequest request, String accessToken);
}
