package personal.court.scheduler.booking.application.port.in;

import java.util.List;

/**
 * 의도 적재 결과
 *
 * @param intents       처리한 의도 수
 * @param created       새로 생성된 작업 수
 * @param duplicates    이미 존재해서 건너뛴 작업 수
 * @param rejected      설정 오류로 거부된 의도 수
 * @param createdJobIds 생성된 작업 ID
 * @param errors        거부 사유
 */
public record IntentLoadReport(
        int intents,
        int created,
        int duplicates,
        int rejected,
        List<Long> createdJobIds,
        List<String> errors
) {
}
