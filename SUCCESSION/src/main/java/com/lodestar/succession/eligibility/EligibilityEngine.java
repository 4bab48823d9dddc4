package com.lodestar.succession.eligibility;

import com.lodestar.succession.domain.model.EligibilityCriteria;
import com.lodestar.succession.domain.model.EligibilityRecord;
import com.lodestar.succession.domain.model.EligibilityRecord.CriterionCheck;
import com.lodestar.succession.domain.model.EligibilityRecord.EligibilityStatus;
import com.lodestar.succession.domain.model.MemberActivity;
import com.lodestar.succession.domain.model.Position;
import com.lodestar.succession.policy.ChapterPolicy;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.*;

/**
 * Evaluates a member's activity against a position's eligibility criteria.
 * <p>
 * Stateless: the same criteria and activity always yield the same status, checks, reasons,
 * score and fingerprint. Only {@code computedAt} reflects the call time.
 * <p>
 * Threshold criteria (tenure, events, training, peer nominations, prior roles, leadership) are
 * hard requirements. When weights are configured, each weighted dimension scores 0-100
 * (actual over required, capped at 100; a dimension without a threshold scores 100) and the
 * weighted sum must reach the criteria's minimum score.
 */
@Component
public class EligibilityEngine {

    static final String TENURE = "tenure";
    static final String EVENTS = "events";
    static final String TRAINING = "training";
    static final String PEER_NOMINATIONS = "peerNominations";
    static final String PRIOR_ROLES = "priorRoles";
    static final String LEADERSHIP = "leadership";
    static final String WEIGHTED_SCORE = "weightedScore";

    public EligibilityRecord evaluate(Position position, MemberActivity activity, ChapterPolicy policy, Instant now) {
        EligibilityCriteria criteria = position.getEligibilityCriteria();
        List<CriterionCheck> checks = new ArrayList<>();

        if (criteria.getMinTenureYears() != null) {
            checks.add(numeric(TENURE, activity.getTenureYears(), criteria.getMinTenureYears(), "y"));
        }
        if (criteria.getMinEventsAttended() != null) {
            checks.add(numeric(EVENTS, activity.getEventsAttended(), criteria.getMinEventsAttended(), ""));
        }
        if (criteria.getMinTrainingSessions() != null) {
            checks.add(numeric(TRAINING, activity.getTrainingSessions(), criteria.getMinTrainingSessions(), ""));
        }
        if (criteria.getMinPeerNominations() != null) {
            checks.add(numeric(PEER_NOMINATIONS, activity.getPeerNominations(), criteria.getMinPeerNominations(), ""));
        }
        if (!criteria.getRequiredPriorRoles().isEmpty()) {
            boolean held = criteria.getRequiredPriorRoles().stream().anyMatch(activity.getPriorRoles()::contains);
            checks.add(CriterionCheck.builder()
                    .criterion(PRIOR_ROLES)
                    .actual(String.join("|", new TreeSet<>(activity.getPriorRoles())))
                    .required("any of " + String.join("|", new TreeSet<>(criteria.getRequiredPriorRoles())))
                    .passed(held)
                    .build());
        }
        if (criteria.isRequireLeadershipExperience()) {
            checks.add(CriterionCheck.builder()
                    .criterion(LEADERSHIP)
                    .actual(Boolean.toString(activity.isLeadershipExperience()))
                    .required("true")
                    .passed(activity.isLeadershipExperience())
                    .build());
        }

        Double score = null;
        if (criteria.isWeighted()) {
            score = round(weightedScore(criteria, activity));
            checks.add(numeric(WEIGHTED_SCORE, score, criteria.getMinimumScore(), ""));
        }

        List<String> reasons = new ArrayList<>();
        for (CriterionCheck check : checks) {
            if (!check.isPassed()) {
                reasons.add(describeFailure(check));
            }
        }

        return EligibilityRecord.builder()
                .positionId(position.getId())
                .memberId(activity.getMemberId())
                .status(reasons.isEmpty() ? EligibilityStatus.ELIGIBLE : EligibilityStatus.INELIGIBLE)
                .checks(checks)
                .reasons(reasons)
                .score(score)
                .inputFingerprint(fingerprint(criteria, activity))
                .computedAt(now)
                .build();
    }

    /**
     * Record for a member whose data could not be fetched.
     */
    public EligibilityRecord pending(String positionId, String memberId, String reason, Instant now) {
        return EligibilityRecord.builder()
                .positionId(positionId)
                .memberId(memberId)
                .status(EligibilityStatus.PENDING)
                .reasons(new ArrayList<>(List.of("member data unavailable: " + reason)))
                .computedAt(now)
                .build();
    }

    /**
     * Validate criteria before a position goes live.
     *
     * @return field name to problem; empty when valid
     */
    public Map<String, String> validate(EligibilityCriteria criteria, ChapterPolicy policy) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (criteria == null) {
            errors.put("eligibilityCriteria", "is required");
            return errors;
        }
        nonNegative(errors, "minTenureYears", criteria.getMinTenureYears());
        nonNegative(errors, "minEventsAttended", criteria.getMinEventsAttended());
        nonNegative(errors, "minTrainingSessions", criteria.getMinTrainingSessions());
        nonNegative(errors, "minPeerNominations", criteria.getMinPeerNominations());

        double[] weights = {criteria.getTenureWeight(), criteria.getEventsWeight(),
                criteria.getLeadershipWeight(), criteria.getSkillsWeight()};
        for (double weight : weights) {
            if (weight < 0 || weight > 100) {
                errors.put("weights", "each weight must be between 0 and 100");
                break;
            }
        }
        double total = criteria.totalWeight();
        if (total != 0 && Math.abs(total - 100) > policy.weightTolerance() * 100) {
            errors.put("weights", "weights must sum to 0 or 100, got " + total);
        }
        if (criteria.getMinimumScore() < 0 || criteria.getMinimumScore() > 100) {
            errors.put("minimumScore", "must be between 0 and 100");
        }
        if (criteria.getSkillsWeight() > 0 && criteria.getRequiredSkills().isEmpty()) {
            errors.put("requiredSkills", "required when skills carry weight");
        }
        return errors;
    }

    /**
     * Stable digest of everything the verdict depends on.
     */
    public String fingerprint(EligibilityCriteria criteria, MemberActivity activity) {
        String canonical = String.join(";",
                "tenure=" + criteria.getMinTenureYears() + "/" + activity.getTenureYears(),
                "events=" + criteria.getMinEventsAttended() + "/" + activity.getEventsAttended(),
                "training=" + criteria.getMinTrainingSessions() + "/" + activity.getTrainingSessions(),
                "peers=" + criteria.getMinPeerNominations() + "/" + activity.getPeerNominations(),
                "roles=" + new TreeSet<>(criteria.getRequiredPriorRoles()) + "/" + new TreeSet<>(activity.getPriorRoles()),
                "skills=" + new TreeSet<>(criteria.getRequiredSkills()) + "/" + new TreeSet<>(activity.getSkills()),
                "leadership=" + criteria.isRequireLeadershipExperience() + "/" + activity.isLeadershipExperience(),
                "weights=" + criteria.getTenureWeight() + "," + criteria.getEventsWeight() + ","
                        + criteria.getLeadershipWeight() + "," + criteria.getSkillsWeight() + ">=" + criteria.getMinimumScore());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private double weightedScore(EligibilityCriteria criteria, MemberActivity activity) {
        double tenureScore = ratioScore(activity.getTenureYears(), criteria.getMinTenureYears());
        double eventsScore = ratioScore(activity.getEventsAttended(),
                criteria.getMinEventsAttended() != null ? criteria.getMinEventsAttended().doubleValue() : null);
        double leadershipScore = activity.isLeadershipExperience() ? 100 : 0;
        double skillsScore = 100;
        if (!criteria.getRequiredSkills().isEmpty()) {
            long matching = criteria.getRequiredSkills().stream().filter(activity.getSkills()::contains).count();
            skillsScore = matching * 100.0 / criteria.getRequiredSkills().size();
        }
        return tenureScore * criteria.getTenureWeight() / 100
                + eventsScore * criteria.getEventsWeight() / 100
                + leadershipScore * criteria.getLeadershipWeight() / 100
                + skillsScore * criteria.getSkillsWeight() / 100;
    }

    private static double ratioScore(double actual, Double required) {
        if (required == null || required <= 0) {
            return 100;
        }
        return Math.min(100, actual / required * 100);
    }

    private static CriterionCheck numeric(String criterion, double actual, double required, String unit) {
        return CriterionCheck.builder()
                .criterion(criterion)
                .actual(format(actual) + unit)
                .required(format(required) + unit)
                .passed(actual >= required)
                .margin(round(actual - required))
                .build();
    }

    private static String describeFailure(CriterionCheck check) {
        if (check.getMargin() != null) {
            return check.getCriterion() + " " + check.getActual() + " < required " + check.getRequired();
        }
        return check.getCriterion() + " " + (check.getActual().isEmpty() ? "none" : check.getActual())
                + " does not meet required " + check.getRequired();
    }

    private static void nonNegative(Map<String, String> errors, String field, Number value) {
        if (value != null && value.doubleValue() < 0) {
            errors.put(field, "must not be negative");
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
