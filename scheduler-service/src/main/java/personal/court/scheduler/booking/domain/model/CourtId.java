package personal.court.scheduler.booking.domain.model;

import personal.court.scheduler.booking.domain.exception.ConfigurationException;

/**
 * Court 식별자 (닫힌 열거형)
 * 외부 예약 API의 amenity_id와 1:1 매핑
 */
public enum CourtId {
    COURT_1("1", 8),
    COURT_2("2", 10);

    private final String code;
    private final int amenityId;

    CourtId(String code, int amenityId) {
        this.code = code;
        this.amenityId = amenityId;
    }

    public String getCode() {
        return code;
    }

    public int getAmenityId() {
        return amenityId;
    }

    /**
     * 다른 코트 (대체 코트 예약 시도용)
     */
    public CourtId alternate() {
        return this == COURT_1 ? COURT_2 : COURT_1;
    }

    public static CourtId fromCode(String code) {
        for (CourtId courtId : values()) {
            if (courtId.code.equals(code)) {
                return courtId;
            }
        }
        throw new ConfigurationException("court_id", "Unknown court: " + code);
    }
}
