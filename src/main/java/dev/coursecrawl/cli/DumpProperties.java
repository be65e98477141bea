package dev.coursecrawl.cli;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the catalog dump, bound from {@code coursecrawl.dump.*}.
 *
 * @param enabled      run the dump at startup
 * @param maxAttempts  attempts per record before the dump gives up
 * @param retryDelayMs pause between attempts
 */
@ConfigurationProperties(prefix = "coursecrawl.dump")
public record DumpProperties(boolean enabled, int maxAttempts, long retryDelayMs) {

    public DumpProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                    "coursecrawl.dump.max-attempts must be at least 1, got: " + maxAttempts);
        }
        if (retryDelayMs < 1) {
            throw new IllegalArgumentException(
                    "coursecrawl.dump.retry-delay-ms must be at least 1, got: " + retryDelayMs);
        }
    }
}
