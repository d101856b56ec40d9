package dev.konduit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Konduit site search application.
 *
 * <p>Exposes the crawl and query endpoints under {@code /api} on port 8000.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class KonduitApplication {
    public static void main(String[] args) {
        SpringApplication.run(KonduitApplication.class, args);
    }
}
