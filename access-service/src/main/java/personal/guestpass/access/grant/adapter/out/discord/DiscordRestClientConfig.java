package personal.guestpass.access.grant.adapter.out.discord;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Discord RestClient Configuration
 *
 * Timeout 전략:
 * - Connect Timeout (500ms): TCP 연결 실패 빠른 감지
 * - Read Timeout (3000ms): Discord rate limit 대기 응답을 고려
 */
@Configuration
public class DiscordRestClientConfig {

    @Value("${external.discord.base-url:https://discord.com/api/v10}")
    private String discordBaseUrl;

    @Value("${external.discord.bot-token}")
    private String botToken;

    @Value("${external.discord.connect-timeout-ms:500}")
    private int connectTimeoutMs;

    @Value("${external.discord.read-timeout-ms:3000}")
    private int readTimeoutMs;

    @Bean
    public RestClient discordRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .baseUrl(discordBaseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
                .requestFactory(requestFactory)
                .build();
    }
}
