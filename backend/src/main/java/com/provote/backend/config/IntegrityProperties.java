package com.provote.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Every fraud threshold and score lives here so operators can tune them
 * without a release. Defaults match the production values.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "provote.integrity")
public class IntegrityProperties {

    private final Fingerprint fingerprint = new Fingerprint();

    private final Idempotency idempotency = new Idempotency();

    private final Cast cast = new Cast();

    private final Cache cache = new Cache();

    private final PatternAnalysis patternAnalysis = new PatternAnalysis();

    @Getter
    @Setter
    public static class Fingerprint {
        /** Window of the durable recent-history query */
        @Min(1)
        private int windowHours = 24;

        /** TTL of the activity cache entry, refreshed on every write */
        private Duration cacheTtl = Duration.ofHours(1);

        @Min(2)
        private int differentUsersThreshold = 2;

        @Min(2)
        private int differentIpsThreshold = 2;

        /** Votes per hour above which a fingerprint counts as rapid */
        @Min(1)
        private double velocityPerHour = 10.0;

        /** Shortest span used when computing the velocity */
        private Duration minimumVelocitySpan = Duration.ofMinutes(1);

        @Min(0) @Max(100)
        private int differentUsersScore = 40;

        @Min(0) @Max(100)
        private int differentIpsScore = 30;

        @Min(0) @Max(100)
        private int velocityScore = 20;

        /** Accumulated score that blocks a vote on its own */
        @Min(1) @Max(100)
        private int blockScore = 70;

        @Min(0) @Max(100)
        private int fingerprintChangeScore = 30;

        @Min(0) @Max(100)
        private int rapidChangeScore = 30;

        @Min(2)
        private int rapidChangeThreshold = 3;

        /** Window of the asynchronous deep analysis (7 days) */
        @Min(1)
        private int deepAnalysisWindowHours = 168;

        @Min(0) @Max(100)
        private int deepAnalysisWarnScore = 70;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private Duration resultTtl = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Cast {
        /** Transaction timeout of a single cast */
        @Min(1)
        private int timeoutSeconds = 5;

        /** Extra attempts after a unique-constraint conflict */
        @Min(0)
        private int conflictRetries = 1;
    }

    @Getter
    @Setter
    public static class Cache {
        @Min(1)
        private int readAttempts = 3;

        private Duration readBackoff = Duration.ofMillis(50);
    }

    @Getter
    @Setter
    public static class PatternAnalysis {
        private boolean enabled = true;

        @Min(1)
        private int windowHours = 24;

        private Duration burstBucket = Duration.ofMinutes(1);

        @Min(2)
        private int burstThreshold = 10;

        @Min(2)
        private int ipClusterThreshold = 5;

        @Min(2)
        private int fingerprintClusterThreshold = 2;

        /** Share of a burst going to a single option that counts as a surge */
        @Min(1) @Max(100)
        private int optionSurgePercent = 90;

        @Min(0) @Max(100)
        private int burstScore = 60;

        @Min(0) @Max(100)
        private int ipClusterScore = 70;

        @Min(0) @Max(100)
        private int fingerprintReuseScore = 80;

        @Min(0) @Max(100)
        private int optionSurgeScore = 75;

        @Min(0) @Max(100)
        private int alertThreshold = 60;

        @Min(0) @Max(100)
        private int flagThreshold = 70;
    }
}
