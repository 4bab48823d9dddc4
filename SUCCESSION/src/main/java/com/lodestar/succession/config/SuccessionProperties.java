package com.lodestar.succession.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the SUCCESSION service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Default chapter policy and per-chapter overrides</li>
 *     <li>Deadline automation and escalation</li>
 *     <li>Eligibility recompute and the member data client</li>
 *     <li>Notification transport</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "succession")
public class SuccessionProperties {

    private final Policy policy = new Policy();
    private final Map<String, Policy> chapters = new HashMap<>();
    private final Automation automation = new Automation();
    private final Eligibility eligibility = new Eligibility();
    private final MemberData memberData = new MemberData();
    private final Notifications notifications = new Notifications();

    /**
     * Chapter-level thresholds. The top-level instance is the default; entries under
     * {@code succession.chapters.<chapterId>} override it field by field when set.
     */
    @Data
    public static class Policy {
        /** Fraction of the seated committee that must vote yes */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double quorumFraction;

        /** Lowest raw evaluation score */
        private Double scoreScaleMin;

        /** Highest raw evaluation score */
        private Double scoreScaleMax;

        private Integer justificationMinLength;

        private Integer justificationMaxLength;

        /** Allowed deviation of rubric weights from 1.0 */
        private Double weightTolerance;

        private Integer withdrawalReasonMinLength;
    }

    /**
     * Deadline automation configuration.
     */
    @Data
    public static class Automation {
        private boolean enabled = true;

        /** Delay between scheduler ticks in milliseconds */
        @Positive
        private long tickIntervalMs = 3_600_000L;

        /** Consecutive failures before a cycle is escalated to admins */
        @Positive
        private int escalationThreshold = 3;

        /** How long before a deadline the warning notification goes out */
        private Duration warningWindow = Duration.ofHours(24);
    }

    /**
     * Eligibility recompute configuration.
     */
    @Data
    public static class Eligibility {
        /** Members evaluated concurrently during a recompute */
        @Positive
        private int parallelism = 8;

        /** Per-member data source timeout */
        private Duration sourceTimeout = Duration.ofSeconds(5);

        /** Upper bound for one full recompute when run inside a transition */
        private Duration recomputeTimeout = Duration.ofMinutes(2);
    }

    /**
     * Member data service client configuration. Blank URL selects the in-memory directory.
     */
    @Data
    public static class MemberData {
        private String baseUrl = "";
        private Duration timeout = Duration.ofSeconds(5);
    }

    /**
     * Notification transport configuration.
     */
    @Data
    public static class Notifications {
        /** {@code logging} or {@code kafka} */
        @NotBlank
        private String transport = "logging";

        private String topic = "lodestar.succession.notifications";

        /** Members who receive admin-facing notices: escalations, warnings, disqualification advice */
        private List<String> adminRecipients = new ArrayList<>();
    }
}
