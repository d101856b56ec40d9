package dev.konduit.crawl;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} shared by {@link PageFetcher} and {@link RobotsPolicyGate}.
 *
 * <p>Both connect and read timeouts come from {@code konduit.crawler.timeout-ms}. The read
 * timeout bounds each socket read only; {@link PageFetcher} enforces the same value as a deadline
 * on the whole page fetch. The client is qualified as {@code "crawlerRestClient"}.
 */
@Configuration
public class CrawlerConfig {

    /**
     * Creates the outbound HTTP client for page and robots.txt requests.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties crawler settings carrying the request timeout
     * @return a named REST client bean
     */
    @Bean
    public RestClient crawlerRestClient(RestClient.Builder builder, CrawlerProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.timeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.timeoutMs()));

        return builder
                .requestFactory(requestFactory)
                .build();
    }
}
