package personal.court.scheduler.booking.adapter.in.bootstrap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import personal.court.scheduler.booking.application.port.in.BookingIntent;
import personal.court.scheduler.booking.application.port.in.IntentLoadReport;
import personal.court.scheduler.booking.application.port.in.LoadIntentsUseCase;
import personal.court.scheduler.config.CourtSchedulerProperties;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 시작 시 schedules.json을 작업 저장소에 반영
 * 스케줄러가 저장소의 PENDING 작업을 등록한 뒤 실행되며, 새로 생긴 작업은 바로 등록된다.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "court.bootstrap", name = "enabled", havingValue = "true")
public class ScheduleFileBootstrapRunner implements ApplicationRunner {

    private final IntentFileReader intentFileReader;
    private final LoadIntentsUseCase loadIntentsUseCase;
    private final CourtSchedulerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        Path path = Path.of(properties.bootstrap().schedulesPath());
        Optional<List<BookingIntent>> intents = intentFileReader.read(path);
        if (intents.isEmpty()) {
            log.warn("Schedules file not found, nothing to load: path={}", path);
            return;
        }

        IntentLoadReport report = loadIntentsUseCase.load(intents.get());
        log.info("Schedules file loaded: path={}, created={}, duplicates={}, rejected={}",
                path, report.created(), report.duplicates(), report.rejected());
        report.errors().forEach(error -> log.warn("Rejected intent in {}: {}", path, error));
    }
}
