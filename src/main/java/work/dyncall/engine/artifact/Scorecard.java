package work.dyncall.engine.artifact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.dyncall.engine.guardrail.StateKeys;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.Timestamps;

/**
 * Rolling per-checksum statistics stored under {@code scorecards.<checksum>}.
 */
public final class Scorecard {
    static final int MAX_STATE_KEY_OBSERVATIONS = 200;
    static final int MAX_SESSIONS = 200;
    static final int SHORT_WINDOW = 20;
    static final int MEDIUM_WINDOW = 200;

    private Scorecard() {}

    public static Map<String, Object> template(String role, String method, String checksum) {
        Map<String, Object> scorecard = new LinkedHashMap<>();
        scorecard.put("tool_name", role);
        scorecard.put("method_name", method);
        scorecard.put("artifact_checksum", checksum);
        scorecard.put("calls", 0);
        scorecard.put("successes", 0);
        scorecard.put("failures", 0);
        scorecard.put("contract_pass_count", 0);
        scorecard.put("contract_fail_count", 0);
        scorecard.put("guardrail_retry_exhausted_count", 0);
        scorecard.put("outcome_retry_exhausted_count", 0);
        scorecard.put("wrong_boundary_count", 0);
        scorecard.put("provenance_violation_count", 0);
        scorecard.put("state_key_observations", new ArrayList<>());
        scorecard.put("state_key_consistency_ratio", 1.0);
        scorecard.put("role_profile_observation_count", 0);
        scorecard.put("role_profile_pass_rate", 1.0);
        scorecard.put("sessions", new ArrayList<>());
        scorecard.put("short_window", new ArrayList<>());
        scorecard.put("medium_window", new ArrayList<>());
        scorecard.put("last_outcome_status", null);
        scorecard.put("updated_at", null);
        return scorecard;
    }

    public static void record(Map<String, Object> scorecard, CallObservation observation) {
        String timestamp = Timestamps.now();
        recordCounts(scorecard, observation);

        List<Object> observations = JsonValues.asList(scorecard.get("state_key_observations"));
        observations.add(StateKeys.fromCode(observation.code()));
        scorecard.put("state_key_observations", tail(observations, MAX_STATE_KEY_OBSERVATIONS));
        scorecard.put("state_key_consistency_ratio", consistencyRatio(observations));

        if (observation.continuity() != null && observation.continuity().evaluated()) {
            int count = JsonValues.intValue(scorecard.get("role_profile_observation_count"), 0) + 1;
            double rate = JsonValues.doubleValue(scorecard.get("role_profile_pass_rate"), 1.0);
            double updated = ((rate * (count - 1)) + observation.continuity().passRate()) / count;
            scorecard.put("role_profile_observation_count", count);
            scorecard.put("role_profile_pass_rate", round4(updated));
        }

        Map<String, Object> window = new LinkedHashMap<>();
        window.put("status", observation.status());
        window.put("error_type", observation.errorType());
        window.put("at", timestamp);
        appendWindow(scorecard, "short_window", window, SHORT_WINDOW);
        appendWindow(scorecard, "medium_window", window, MEDIUM_WINDOW);
        scorecard.put("last_outcome_status", observation.status());
        scorecard.put("updated_at", timestamp);
    }

    /**
     * Counters shared with lifecycle recovery windows: calls, outcome split, contract results,
     * exhaustion and boundary counts, sessions.
     */
    static void recordCounts(Map<String, Object> counts, CallObservation observation) {
        increment(counts, "calls");
        increment(counts, observation.ok() ? "successes" : "failures");
        if (observation.contractApplied()) {
            if (Boolean.TRUE.equals(observation.contractPassed())) {
                increment(counts, "contract_pass_count");
            } else if (Boolean.FALSE.equals(observation.contractPassed())) {
                increment(counts, "contract_fail_count");
            }
        }
        if (observation.guardrailRetryExhausted()) {
            increment(counts, "guardrail_retry_exhausted_count");
        }
        if (observation.outcomeRetryExhausted()) {
            increment(counts, "outcome_retry_exhausted_count");
        }
        if ("wrong_tool_boundary".equals(observation.errorType())) {
            increment(counts, "wrong_boundary_count");
        }
        if ("tool_registry_violation".equals(observation.errorType())
            && observation.errorMessage().toLowerCase().contains("provenance")) {
            increment(counts, "provenance_violation_count");
        }
        String session = observation.traceId();
        if (session != null && !session.isBlank()) {
            List<Object> sessions = JsonValues.asList(counts.get("sessions"));
            if (!sessions.contains(session)) {
                sessions.add(session);
            }
            counts.put("sessions", tail(sessions, MAX_SESSIONS));
        }
    }

    static double consistencyRatio(List<Object> observations) {
        Map<String, Integer> tally = new LinkedHashMap<>();
        int total = 0;
        for (Object entry : observations) {
            if (entry instanceof List<?> keys && !keys.isEmpty()) {
                List<String> sorted = new ArrayList<>();
                keys.forEach(key -> sorted.add(String.valueOf(key)));
                sorted.sort(null);
                tally.merge(sorted.get(0), 1, Integer::sum);
                total++;
            }
        }
        if (total == 0) {
            return 1.0;
        }
        int max = 0;
        for (int count : tally.values()) {
            max = Math.max(max, count);
        }
        return round4((double) max / total);
    }

    /** Most recent primary state key recorded for this scorecard, or {@code null}. */
    public static String latestPrimaryStateKey(Map<String, Object> scorecard) {
        if (scorecard == null) {
            return null;
        }
        List<Object> observations = JsonValues.asList(scorecard.get("state_key_observations"));
        if (observations.isEmpty() || !(observations.get(observations.size() - 1) instanceof List<?> keys) || keys.isEmpty()) {
            return null;
        }
        List<String> sorted = new ArrayList<>();
        keys.forEach(key -> sorted.add(String.valueOf(key)));
        sorted.sort(null);
        return sorted.get(0);
    }

    static double round4(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }

    private static void increment(Map<String, Object> counts, String key) {
        counts.put(key, JsonValues.intValue(counts.get(key), 0) + 1);
    }

    private static void appendWindow(Map<String, Object> scorecard, String key, Map<String, Object> entry, int limit) {
        List<Object> window = JsonValues.asList(scorecard.get(key));
        window.add(entry);
        scorecard.put(key, tail(window, limit));
    }

    private static List<Object> tail(List<Object> values, int limit) {
        if (values.size() <= limit) {
            return values;
        }
        return new ArrayList<>(values.subList(values.size() - limit, values.size()));
    }
}
