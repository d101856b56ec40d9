package dev.konduit.crawl;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRules.RobotRulesMode;
import crawlercommons.robots.SimpleRobotRulesParser;

/**
 * Decides whether a URL may be fetched according to its origin's robots.txt, using
 * crawler-commons for the exclusion-rule semantics.
 *
 * <p>Rules are evaluated for an agent name no site targets, so the wildcard ({@code *}) group is
 * the one that applies. Status handling:
 * <ul>
 *   <li>2xx: parse the body and apply it</li>
 *   <li>401/403: the whole origin is off limits</li>
 *   <li>other 4xx: no robots.txt, everything allowed</li>
 *   <li>5xx, timeouts, transport or parse errors: {@link PolicyDecision#UNREADABLE} (fail closed)</li>
 * </ul>
 *
 * <p>Every decision is appended to the {@link PolicyAuditLog}.
 */
@Component
public class RobotsPolicyGate {

    private static final Logger log = LoggerFactory.getLogger(RobotsPolicyGate.class);

    static final String AGENT_NAME = "konduit";

    private final RestClient restClient;
    private final PolicyAuditLog auditLog;

    public RobotsPolicyGate(@Qualifier("crawlerRestClient") RestClient restClient,
                            PolicyAuditLog auditLog) {
        this.restClient = restClient;
        this.auditLog = auditLog;
    }

    /**
     * Evaluate a single URL, fetching its origin's robots.txt.
     *
     * @param url the candidate URL
     * @return the policy decision for the URL
     */
    PolicyDecision evaluate(String url) {
        return evaluate(url, new HashMap<>());
    }

    /**
     * Evaluate a URL reusing rules already fetched during the same crawl. Only readable rule sets
     * are stored in {@code rulesByOrigin}; an unreadable robots.txt is attempted again next time.
     *
     * @param url           the candidate URL
     * @param rulesByOrigin per-crawl cache keyed by origin (scheme://host[:port])
     * @return the policy decision for the URL
     */
    public PolicyDecision evaluate(String url, Map<String, SimpleRobotRules> rulesByOrigin) {
        PolicyDecision decision = decide(url, rulesByOrigin);
        switch (decision) {
            case ALLOWED -> log.debug("Allowed by robots.txt: {}", url);
            case BLOCKED -> log.info("Disallowed by robots.txt: {}", url);
            case UNREADABLE -> log.warn("Could not read robots.txt for {}, defaulting to disallow", url);
        }
        auditLog.record(decision, url);
        return decision;
    }

    private PolicyDecision decide(String url, Map<String, SimpleRobotRules> rulesByOrigin) {
        String origin;
        try {
            origin = UrlNormalizer.normalizeToBase(url);
        } catch (IllegalArgumentException e) {
            return PolicyDecision.UNREADABLE;
        }

        SimpleRobotRules rules = rulesByOrigin.get(origin);
        if (rules == null) {
            rules = fetchRules(origin + "/robots.txt");
            if (rules == null) {
                return PolicyDecision.UNREADABLE;
            }
            rulesByOrigin.put(origin, rules);
        }
        return rules.isAllowed(url) ? PolicyDecision.ALLOWED : PolicyDecision.BLOCKED;
    }

    /**
     * Fetch and parse robots.txt, returning null when it cannot be read.
     */
    private @Nullable SimpleRobotRules fetchRules(String robotsUrl) {
        try {
            return restClient.get()
                    .uri(URI.create(robotsUrl))
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        if (response.getStatusCode().is2xxSuccessful()) {
                            byte[] body = response.getBody().readAllBytes();
                            return new SimpleRobotRulesParser()
                                    .parseContent(robotsUrl, body, "text/plain", List.of(AGENT_NAME));
                        }
                        return rulesForStatus(robotsUrl, status);
                    });
        } catch (RestClientException | IllegalArgumentException e) {
            log.debug("robots.txt fetch failed for {}: {}", robotsUrl, e.getMessage());
            return null;
        }
    }

    private @Nullable SimpleRobotRules rulesForStatus(String robotsUrl, int status) {
        if (status == 401 || status == 403) {
            return new SimpleRobotRules(RobotRulesMode.ALLOW_NONE);
        }
        if (status >= 400 && status < 500) {
            return new SimpleRobotRules(RobotRulesMode.ALLOW_ALL);
        }
        log.debug("robots.txt at {} answered {}", robotsUrl, status);
        return null;
    }
}
