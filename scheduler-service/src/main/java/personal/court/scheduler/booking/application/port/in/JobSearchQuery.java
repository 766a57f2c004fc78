package personal.court.scheduler.booking.application.port.in;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.JobStatus;

/**
 * 작업 검색 조건
 */
public record JobSearchQuery(
        JobStatus status,
        CourtId courtId,
        int offset,
        int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public JobSearchQuery {
        if (offset < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Offset must be >= 0: " + offset);
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Limit must be between 1 and %d: %d", MAX_LIMIT, limit));
        }
    }
}
