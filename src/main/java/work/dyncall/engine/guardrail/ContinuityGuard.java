package work.dyncall.engine.guardrail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that sibling methods of a role agree on the memory slot a continuity profile ties them to.
 * Observations come from the program being validated, from prior observations in this process and,
 * through {@link PriorObservations}, from persisted artifacts.
 */
public final class ContinuityGuard {
    private static final Logger log = LoggerFactory.getLogger(ContinuityGuard.class);
    public static final String SUBTYPE = "role_profile_continuity_violation";

    /** Source of previously recorded primary state keys, usually the artifact store. */
    @FunctionalInterface
    public interface PriorObservations {
        Optional<String> primaryStateKey(String role, String method);

        static PriorObservations none() {
            return (role, method) -> Optional.empty();
        }
    }

    private final boolean enforced;
    private final PriorObservations prior;
    private final Map<String, Map<String, String>> observed = new ConcurrentHashMap<>();

    public ContinuityGuard(boolean enforced, PriorObservations prior) {
        this.enforced = enforced;
        this.prior = prior == null ? PriorObservations.none() : prior;
    }

    public boolean enforced() {
        return enforced;
    }

    public ContinuityReport evaluate(ContinuityProfile profile, String method, String code) {
        if (profile == null) {
            return null;
        }
        var applicable = profile.constraintsFor(method);
        if (applicable.isEmpty()) {
            return ContinuityReport.empty(profile.version());
        }
        Map<String, String> roleObservations = observed.computeIfAbsent(profile.role(), key -> new ConcurrentHashMap<>());
        String current = StateKeys.primaryKey(code);

        List<Map<String, Object>> results = new ArrayList<>();
        List<String> violationTypes = new ArrayList<>();
        String reason = null;
        String hint = null;
        for (Map.Entry<String, ContinuityProfile.Constraint> entry : applicable) {
            ContinuityProfile.Constraint constraint = entry.getValue();
            List<String> observations = new ArrayList<>();
            for (String sibling : constraint.methods()) {
                String key = sibling.equals(method) ? current : lookup(profile.role(), sibling, roleObservations);
                if (key != null) {
                    observations.add(key);
                }
            }
            boolean passed = passes(constraint, observations);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("constraint", entry.getKey());
            result.put("kind", constraint.kind());
            result.put("mode", constraint.mode().wireName());
            result.put("methods", constraint.methods());
            result.put("observations", observations);
            result.put("passed", passed);
            result.put("type", constraint.kind() + "_drift");
            if (!passed) {
                String constraintReason = constraint.canonicalKey() != null
                    ? "state key diverged from expected value '" + constraint.canonicalKey() + "'"
                    : "state key diverged across sibling methods";
                String constraintHint = correctionHint(constraint, observations);
                result.put("reason", constraintReason);
                result.put("correction_hint", constraintHint);
                violationTypes.add(constraint.kind() + "_drift");
                if (reason == null) {
                    reason = constraintReason;
                    hint = constraintHint;
                }
            }
            results.add(result);
        }
        if (current != null) {
            roleObservations.put(method, current);
        }
        int total = results.size();
        double passRate = Math.round((total - violationTypes.size()) * 10000.0 / total) / 10000.0;
        ContinuityReport report = new ContinuityReport(profile.version(), true, passRate, violationTypes.isEmpty(),
            violationTypes, reason, hint, results);
        if (!report.passed()) {
            log.info("Continuity drift for {}.{} ({}): {}", profile.role(), method, enforced ? "enforced" : "shadow", reason);
        }
        return report;
    }

    /** The violation to raise for a failed report, or empty in shadow mode. */
    public Optional<GuardrailViolation> violationFor(ContinuityReport report) {
        if (report == null || report.passed() || !enforced) {
            return Optional.empty();
        }
        return Optional.of(GuardrailViolation.of(SUBTYPE,
            SUBTYPE + ": " + report.reason() + ". correction: " + report.correctionHint(),
            report.correctionHint()));
    }

    private String lookup(String role, String method, Map<String, String> roleObservations) {
        Optional<String> persisted = prior.primaryStateKey(role, method);
        if (persisted.isPresent()) {
            return persisted.get();
        }
        return roleObservations.get(method);
    }

    private static boolean passes(ContinuityProfile.Constraint constraint, List<String> observations) {
        if (observations.isEmpty()) {
            return true;
        }
        if (constraint.mode() == ContinuityProfile.Mode.PRESCRIPTIVE) {
            for (String value : observations) {
                if (!value.equals(constraint.canonicalKey())) {
                    return false;
                }
            }
            return true;
        }
        return new LinkedHashSet<>(observations).size() == 1;
    }

    private static String correctionHint(ContinuityProfile.Constraint constraint, List<String> observations) {
        if (constraint.canonicalKey() != null) {
            return "Use '" + constraint.canonicalKey() + "' consistently for this profile constraint.";
        }
        Map<String, Integer> tally = new LinkedHashMap<>();
        for (String value : observations) {
            tally.merge(value, 1, Integer::sum);
        }
        String target = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : tally.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                target = entry.getKey();
            }
        }
        return target == null
            ? "Align sibling methods to one shared value for this constraint."
            : "Align sibling methods to '" + target + "' for this profile constraint.";
    }
}
