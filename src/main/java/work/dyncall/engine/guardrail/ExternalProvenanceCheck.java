package work.dyncall.engine.guardrail;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.dyncall.engine.api.Outcome;

/**
 * Successful external-data flows must say where their data came from: {@code provenance.sources[]}
 * with {@code uri}, {@code fetched_at}, {@code retrieval_tool} and a known {@code retrieval_mode}.
 */
public final class ExternalProvenanceCheck implements GuardrailCheck {
    public static final String SUBTYPE = "missing_external_provenance";
    static final Set<String> RETRIEVAL_MODES = Set.of("live", "cached", "fixture");

    @Override
    public String name() {
        return "external_provenance";
    }

    @Override
    public GuardrailStage stage() {
        return GuardrailStage.OUTCOME;
    }

    @Override
    public Optional<GuardrailViolation> evaluate(GuardrailSubject subject) {
        Outcome outcome = subject.outcome();
        if (outcome == null || !outcome.isOk()) {
            return Optional.empty();
        }
        if (!ExternalDataFlow.EXTERNAL_SOURCE.matcher(subject.codeWithoutComments()).find()) {
            return Optional.empty();
        }
        if (hasProvenance(outcome.value())) {
            return Optional.empty();
        }
        return Optional.of(GuardrailViolation.of(SUBTYPE,
            "External-data success must include `provenance.sources[]` with "
                + "`uri`, `fetched_at`, `retrieval_tool`, and `retrieval_mode` (`live|cached|fixture`).",
            "For external-data success, return a value with `provenance: { sources: [...] }` and include "
                + "`uri`, `fetched_at`, `retrieval_tool`, `retrieval_mode` (`live|cached|fixture`) for each source."));
    }

    static boolean hasProvenance(Object value) {
        if (!(value instanceof Map<?, ?> map) || !(map.get("provenance") instanceof Map<?, ?> provenance)) {
            return false;
        }
        if (!(provenance.get("sources") instanceof List<?> sources) || sources.isEmpty()) {
            return false;
        }
        for (Object source : sources) {
            if (!validSource(source)) {
                return false;
            }
        }
        return true;
    }

    private static boolean validSource(Object entry) {
        if (!(entry instanceof Map<?, ?> source)) {
            return false;
        }
        for (String field : List.of("uri", "fetched_at", "retrieval_tool")) {
            Object value = source.get(field);
            if (value == null || String.valueOf(value).isBlank()) {
                return false;
            }
        }
        Object mode = source.get("retrieval_mode");
        return mode != null && RETRIEVAL_MODES.contains(String.valueOf(mode).trim().toLowerCase());
    }
}
