package work.dyncall.engine.guardrail;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ContinuityReport(
    int profileVersion,
    boolean evaluated,
    double passRate,
    boolean passed,
    List<String> violationTypes,
    String reason,
    String correctionHint,
    List<Map<String, Object>> constraintResults
) {
    public ContinuityReport {
        violationTypes = List.copyOf(violationTypes == null ? List.of() : violationTypes);
        constraintResults = List.copyOf(constraintResults == null ? List.of() : constraintResults);
    }

    static ContinuityReport empty(int profileVersion) {
        return new ContinuityReport(profileVersion, false, 1.0, true, List.of(), null, null, List.of());
    }

    public int violationCount() {
        return violationTypes.size();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("profile_version", profileVersion);
        map.put("evaluated", evaluated);
        map.put("continuity_pass_rate", passRate);
        map.put("passed", passed);
        map.put("violation_count", violationCount());
        map.put("violation_types", violationTypes);
        map.put("correction_hint", correctionHint);
        map.put("reason", reason);
        map.put("constraint_results", constraintResults);
        return map;
    }
}
