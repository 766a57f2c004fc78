package personal.court.scheduler.credential.adapter.out.external;

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
 * 인증 서버 RestClient 설정
 */
@Configuration
public class AuthRestClientConfig {

    @Value("${external.auth.base-url}")
    private String authBaseUrl;

    @Value("${external.auth.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Value("${external.auth.read-timeout-ms:5000}")
    private int readTimeoutMs;

    @Bean
    public RestClient authRestClient(ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .baseUrl(authBaseUrl)
                .requestFactory(requestFactory)
                .requestInterceptor(new OutboundHttpLoggingInterceptor("token_refresh", objectMapper))
                .build();
    }
}
