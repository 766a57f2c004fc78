package personal.court.scheduler.booking.adapter.out.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import personal.court.scheduler.config.OutboundHttpLoggingInterceptor;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClient Configuration
 * 코트 예약 API 클라이언트 설정
 *
 * Timeout 전략:
 * - Connect Timeout: TCP 연결 실패 빠른 감지 (재시도 예산 안에서 다시 시도)
 * - Read Timeout: 예약 API의 느린 응답을 일시적 실패로 처리
 *
 * 모든 호출은 OutboundHttpLoggingInterceptor가 court_booking operation으로 기록한다.
 */
@Configuration
public class RestClientConfig {

    @Value("${external.court-booking.base-url}")
    private String courtBookingBaseUrl;

    @Value("${external.court-booking.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Value("${external.court-booking.read-timeout-ms:10000}")
    private int readTimeoutMs;

    @Bean
    public RestClient courtBookingRestClient(ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .baseUrl(courtBookingBaseUrl)
                .requestFactory(requestFactory)
                .requestInterceptor(new OutboundHttpLoggingInterceptor("court_booking", objectMapper))
                .build();
    }
}
