package personal.court.scheduler.booking.application.port.in;

import java.util.List;

/**
 * Load Intents UseCase (Input Port)
 * 예약 의도 스냅샷을 작업 저장소와 맞춘다 (여러 번 적재해도 결과 동일)
 */
public interface LoadIntentsUseCase {

    IntentLoadReport load(List<BookingIntent> intents);
}
