package mta.eda.receipts.config;

import mta.eda.receipts.model.receipt.GenerateOptions;
import mta.eda.receipts.model.receipt.GenerationMethod;
import mta.eda.receipts.model.schedule.TimingConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

@Configuration
public class ReceiptServiceConfig {

    @Value("${order-details.connect-timeout.ms:5000}")
    private long connectTimeoutMs;

    @Value("${order-details.timeout.ms:15000}")
    private long readTimeoutMs;

    @Value("${scheduler.delay-between-orders.ms:5000}")
    private long delayBetweenOrdersMs;

    @Value("${scheduler.max-concurrent:1}")
    private int maxConcurrent;

    @Value("${scheduler.retry-attempts:3}")
    private int retryAttempts;

    @Value("${scheduler.initial-delay.ms:0}")
    private long initialDelayMs;

    @Value("${scheduler.minimum-delay.ms:0}")
    private long minimumDelayMs;

    @Value("${receipts.include-images:true}")
    private boolean includeImages;

    @Value("${receipts.method:print}")
    private String method;

    /**
     * HTTP client shared by every order-details request. A request whose read timeout
     * passes is cancelled by the client and its connection closed.
     */
    @Bean
    public HttpClient orderDetailsHttpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * RestTemplate for the vendor order-details endpoint. The fetcher narrows the read
     * timeout per call; this one applies the configured default.
     */
    @Bean
    public RestTemplate orderDetailsRestTemplate(RestTemplateBuilder builder, HttpClient orderDetailsHttpClient) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(orderDetailsHttpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return builder
                .requestFactory(() -> requestFactory)
                .build();
    }

    /**
     * Timing rules used when a schedule is requested without explicit rules.
     */
    @Bean
    public TimingConfig defaultTimingConfig() {
        return new TimingConfig(delayBetweenOrdersMs, maxConcurrent, retryAttempts,
                initialDelayMs, minimumDelayMs, Map.of(), null);
    }

    @Bean
    public GenerateOptions generateOptions() {
        return new GenerateOptions(includeImages, GenerationMethod.fromWire(method));
    }
}
