package work.dyncall.engine.execution;

import java.util.Objects;
import work.dyncall.engine.contract.DeliverableContract;
import work.dyncall.engine.guardrail.ContinuityProfile;
import work.dyncall.engine.runtime.Invocation;
import work.dyncall.engine.sandbox.SandboxCapabilities;

/**
 * Everything the controller needs about the agent behind one invocation.
 *
 * @param contract deliverable the result must satisfy, may be {@code null}
 * @param profile continuity profile of the role, may be {@code null}
 */
public record CallScope(
    Invocation invocation,
    RoleMemory memory,
    DeliverableContract contract,
    String purpose,
    ContinuityProfile profile,
    SandboxCapabilities capabilities
) {
    public CallScope {
        Objects.requireNonNull(invocation, "invocation");
        Objects.requireNonNull(memory, "memory");
        capabilities = capabilities == null ? SandboxCapabilities.none() : capabilities;
    }

    public String role() {
        return invocation.role();
    }

    public String method() {
        return invocation.method();
    }

    public int depth() {
        return invocation.frame().depth();
    }

    public String contractFingerprint() {
        return DeliverableContract.fingerprint(contract);
    }
}
