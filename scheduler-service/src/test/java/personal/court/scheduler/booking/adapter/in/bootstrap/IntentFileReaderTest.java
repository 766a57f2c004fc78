package personal.court.scheduler.booking.adapter.in.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import personal.court.scheduler.booking.application.port.in.BookingIntent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IntentFileReader 단위 테스트")
class IntentFileReaderTest {

    private final IntentFileReader reader = new IntentFileReader(new ObjectMapper());

    @TempDir
    Path dir;

    @Test
    @DisplayName("schedules.json 항목을 예약 의도로 읽는다")
    void read() throws IOException {
        // given
        Path file = dir.resolve("schedules.json");
        Files.writeString(file, """
                [
                  {"type": "recurring", "rrule": "FREQ=WEEKLY;BYDAY=MO,WE;BYHOUR=19", "court_id": "1", "duration": 60},
                  {"type": "one-off", "desired_time": "2026-03-20T19:00:00", "court_id": "2", "comment": "friday"}
                ]
                """);

        // when
        Optional<List<BookingIntent>> intents = reader.read(file);

        // then
        assertThat(intents).isPresent();
        assertThat(intents.get()).containsExactly(
                new BookingIntent("recurring", null, "1", 60, "FREQ=WEEKLY;BYDAY=MO,WE;BYHOUR=19"),
                new BookingIntent("one-off", "2026-03-20T19:00:00", "2", null, null));
    }

    @Test
    @DisplayName("파일이 없으면 empty")
    void read_Missing() {
        assertThat(reader.read(dir.resolve("absent.json"))).isEmpty();
    }

    @Test
    @DisplayName("JSON 형식이 아니면 예외")
    void read_Malformed() throws IOException {
        // given
        Path file = dir.resolve("schedules.json");
        Files.writeString(file, "{ not json");

        // when & then
        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Cannot read intent file");
    }
}
