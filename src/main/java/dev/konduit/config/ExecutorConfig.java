package dev.konduit.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Worker pools that keep request threads responsive.
 *
 * <ul>
 *   <li>{@code crawlExecutor} runs independent site crawls side by side (one task per seed).
 *   <li>{@code indexBuildExecutor} is single-threaded, so index builds never overlap and each
 *       submitted build completes before the next one starts.
 * </ul>
 */
@Configuration
public class ExecutorConfig {

  @Bean(destroyMethod = "shutdown")
  public ExecutorService crawlExecutor(@Value("${konduit.crawler.site-parallelism:2}") int sites) {
    return Executors.newFixedThreadPool(sites, new CustomizableThreadFactory("crawl-"));
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService indexBuildExecutor() {
    return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("index-build-"));
  }
}
