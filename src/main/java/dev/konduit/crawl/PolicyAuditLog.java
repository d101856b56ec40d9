package dev.konduit.crawl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Append-only audit trail of robots.txt decisions, one line per checked URL:
 * {@code 2026-10-19T08:15:30Z [BLOCKED] https://example.com/private}.
 *
 * <p>Writes are serialised so concurrent crawls never interleave partial lines. A failing write
 * is logged and dropped; auditing never blocks a crawl.
 */
@Component
public class PolicyAuditLog {

    private static final Logger log = LoggerFactory.getLogger(PolicyAuditLog.class);

    private final Path path;
    private final Clock clock;

    @Autowired
    public PolicyAuditLog(CrawlerProperties properties, Clock clock) {
        this(Path.of(properties.auditLog()), clock);
    }

    PolicyAuditLog(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    /**
     * Append one decision for a URL.
     *
     * @param decision the robots.txt outcome
     * @param url      the URL that was checked
     */
    public synchronized void record(PolicyDecision decision, String url) {
        String line = "%s [%s] %s%n".formatted(Instant.now(clock), decision.auditLabel(), url);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not append to robots audit log {}: {}", path, e.getMessage());
        }
    }

    Path path() {
        return path;
    }
}
