package personal.court.scheduler.booking.adapter.in.bootstrap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.court.scheduler.booking.adapter.in.web.dto.IntentRequest;
import personal.court.scheduler.booking.application.port.in.BookingIntent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * schedules.json 읽기
 * [{"type": "recurring", "rrule": "FREQ=WEEKLY;BYDAY=MO;BYHOUR=19", "court_id": "1", "duration": 60}, ...]
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentFileReader {

    private static final TypeReference<List<IntentRequest>> INTENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * @return 파일이 없으면 empty
     * @throws UncheckedIOException 파일을 읽을 수 없거나 JSON 형식이 아닐 때
     */
    public Optional<List<BookingIntent>> read(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            List<IntentRequest> entries = objectMapper.readValue(path.toFile(), INTENT_LIST);
            log.debug("Intent file parsed: path={}, entries={}", path, entries.size());
            return Optional.of(entries.stream().map(IntentRequest::toIntent).toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read intent file: " + path, e);
        }
    }
}
