package work.dyncall.engine.generation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.dyncall.engine.artifact.SelectedArtifact;
import work.dyncall.engine.contract.DeliverableContract;
import work.dyncall.engine.failure.FailureClass;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Builds the system and user prompts sent to the code generator, including retry feedback and
 * repair invocations.
 */
public final class PromptComposer {
    private PromptComposer() {}

    public static Map<String, Object> toolSchema() {
        Map<String, Object> dependencyItem = new LinkedHashMap<>();
        dependencyItem.put("type", "object");
        dependencyItem.put("properties", Map.of(
            "name", Map.of("type", "string", "description", "Library coordinate (name or group:artifact)"),
            "version", Map.of("type", "string", "description", "Version constraint (optional)")));
        dependencyItem.put("required", List.of("name"));
        dependencyItem.put("additionalProperties", false);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("code", Map.of("type", "string", "description", "JavaScript function body to execute"));
        properties.put("dependencies", Map.of("type", "array", "items", dependencyItem));
        properties.put("cacheable", Map.of("type", "boolean", "description", "Whether the program may be reused for later calls"));
        properties.put("cacheability_reason", Map.of("type", "string"));
        properties.put("input_sensitive", Map.of("type", "boolean"));

        Map<String, Object> inputSchema = new LinkedHashMap<>();
        inputSchema.put("type", "object");
        inputSchema.put("properties", properties);
        inputSchema.put("required", List.of("code"));
        inputSchema.put("additionalProperties", false);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("name", "execute_code");
        schema.put("description", "Provide JavaScript code and dependency declarations");
        schema.put("input_schema", inputSchema);
        return schema;
    }

    public static String systemPrompt(String role, int depth, DeliverableContract contract, String purpose) {
        String opening = switch (depth) {
            case 0 -> "You are a Tool Builder operating as an agent called '" + role + "'.\n"
                + "You create durable, reusable tools by generating JavaScript that runs in your context.";
            case 1 -> "You are a Tool operating as an agent called '" + role + "'.\n"
                + "You execute delegated work by generating JavaScript that runs in your context.";
            default -> "You are a Worker operating as an agent called '" + role + "'.\n"
                + "You execute tasks directly by generating JavaScript that runs in your context.";
        };
        StringBuilder prompt = new StringBuilder(opening).append("\n\n");
        prompt.append("The code is the body of `function(context, args, kwargs, api, call)`.\n");
        prompt.append("`context` is your persistent memory (a plain object). `call` describes this invocation.\n");
        prompt.append("Capabilities: api.delegate(role[, options]).call(method, args, kwargs), api.tool(name), ")
            .append("api.remember(key, value), api.recall(key), api.ok(value), api.error(type, message[, retriable]), api.log(...).\n");
        prompt.append("Every delegated call returns an Outcome object: {status, value, error_type, error_message, retriable, metadata}.\n");
        prompt.append("context.tools is registry metadata keyed by tool name, never callable objects.\n");
        if (purpose != null && !purpose.isBlank()) {
            prompt.append("\n<purpose>").append(purpose).append("</purpose>\n");
        }
        if (contract != null) {
            prompt.append("\n<active_contract>\n<deliverable>")
                .append(JsonValues.render(contract.raw()))
                .append("</deliverable>\n</active_contract>\n");
        }
        return prompt.toString();
    }

    public static String userPrompt(String method, List<Object> args, Map<String, Object> kwargs, int depth,
                                    Map<String, Object> memory, Map<String, Object> knownTools) {
        Map<String, Object> visibleMemory = new LinkedHashMap<>(memory == null ? Map.of() : memory);
        visibleMemory.remove("tools");
        StringBuilder prompt = new StringBuilder();
        prompt.append("<invocation>\n<action>\n")
            .append("<method>").append(method).append("</method>\n")
            .append("<args>").append(JsonValues.render(args)).append("</args>\n")
            .append("<kwargs>").append(JsonValues.render(kwargs)).append("</kwargs>\n")
            .append("</action>\n")
            .append("<current_depth>").append(depth).append("</current_depth>\n")
            .append("<memory>").append(JsonValues.render(visibleMemory)).append("</memory>\n")
            .append("</invocation>\n\n");
        prompt.append("<known_tools>\n");
        if (knownTools != null) {
            knownTools.forEach((name, metadata) -> {
                Object purpose = metadata instanceof Map<?, ?> entry ? entry.get("purpose") : null;
                Object methods = metadata instanceof Map<?, ?> entry ? entry.get("methods") : null;
                prompt.append("- ").append(name).append(": ").append(purpose == null ? "" : purpose)
                    .append(methods == null ? "" : " methods=" + JsonValues.render(methods)).append('\n');
            });
        }
        prompt.append("</known_tools>\n\n");
        prompt.append("<response_contract>\n")
            .append("- Return an execute_code payload with `code` and optional `dependencies`.\n")
            .append("- Return the raw domain value with `return`, or an explicit api.ok/api.error outcome.\n")
            .append("</response_contract>\n");
        return prompt.toString();
    }

    /** Appends guardrail, execution and outcome feedback blocks, in that order. */
    public static String withFeedback(String base, List<RetryFeedback> feedback) {
        if (feedback == null || feedback.isEmpty()) {
            return base;
        }
        StringBuilder prompt = new StringBuilder(base);
        for (RetryFeedback.Kind kind : RetryFeedback.Kind.values()) {
            for (RetryFeedback entry : feedback) {
                if (entry.kind() == kind) {
                    prompt.append('\n').append(entry.render());
                }
            }
        }
        return prompt.toString();
    }

    public static String invalidPayloadRetry(String base, int attempt, int maxAttempts, String lastError) {
        if (attempt <= 1) {
            return base;
        }
        return base + "\n"
            + "IMPORTANT: Previous generation failed (" + (lastError == null ? "invalid generator output" : lastError) + ").\n"
            + "Retry " + attempt + "/" + maxAttempts + ".\n"
            + "You MUST return a valid execute_code payload with non-empty `code` and an optional `dependencies` array.\n"
            + "If an unavailable capability is the blocker, do NOT recurse via delegation. "
            + "Return api.error(\"unsupported_capability\", message, false).\n";
    }

    public static String repairPrompt(String method, List<Object> args, Map<String, Object> kwargs,
                                      SelectedArtifact artifact, FailureClass failureClass, String failureMessage) {
        return "<repair_invocation>\n"
            + "<method>" + method + "</method>\n"
            + "<args>" + JsonValues.render(args) + "</args>\n"
            + "<kwargs>" + JsonValues.render(kwargs) + "</kwargs>\n"
            + "<failure_class>" + (failureClass == null ? "unknown" : failureClass.wireName()) + "</failure_class>\n"
            + "<failure_message>" + (failureMessage == null ? "" : failureMessage) + "</failure_message>\n"
            + "<existing_code>\n" + artifact.code() + "\n</existing_code>\n"
            + "<artifact_metadata>\n"
            + "<prompt_version>" + artifact.promptVersion() + "</prompt_version>\n"
            + "<contract_fingerprint>" + artifact.contractFingerprint() + "</contract_fingerprint>\n"
            + "</artifact_metadata>\n"
            + "</repair_invocation>\n\n"
            + "<repair_goal>\n"
            + "Repair this existing method implementation. Preserve intent and contract compatibility.\n"
            + "Do not invent new capabilities. Ensure returned code executes for the provided args/kwargs.\n"
            + "</repair_goal>\n";
    }
}
