package work.dyncall.engine.failure;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FailureClassTest {
    @Test
    void upstreamAndEnvironmentFailuresAreExtrinsic() {
        assertEquals(FailureClass.EXTRINSIC, FailureClass.classify("timeout"));
        assertEquals(FailureClass.EXTRINSIC, FailureClass.classify("worker_crash"));
        assertEquals(FailureClass.EXTRINSIC, FailureClass.classify("dependency_install_failed"));
    }

    @Test
    void logicFailuresAreAdaptive() {
        assertEquals(FailureClass.ADAPTIVE, FailureClass.classify("contract_violation"));
        assertEquals(FailureClass.ADAPTIVE, FailureClass.classify("low_utility"));
        assertEquals(FailureClass.ADAPTIVE, FailureClass.classify(" guardrail_retry_exhausted "));
    }

    @Test
    void everythingElseIsIntrinsic() {
        assertEquals(FailureClass.INTRINSIC, FailureClass.classify("budget_exceeded"));
        assertEquals(FailureClass.INTRINSIC, FailureClass.classify("some_domain_error"));
        assertEquals(FailureClass.INTRINSIC, FailureClass.classify(null, new IllegalStateException("boom")));
    }

    @Test
    void untypedTimeoutExceptionsAreExtrinsic() {
        var ex = new DynamicCallException(ErrorType.TIMEOUT, "slow");
        assertEquals(FailureClass.EXTRINSIC, FailureClass.classify(null, ex));
    }

    @Test
    void errorTypesRoundTripThroughWireNames() {
        assertEquals(ErrorType.WORKER_CRASH, ErrorType.fromWireName("worker_crash"));
        assertEquals(ErrorType.EXECUTION, ErrorType.fromWireName("not_a_type"));
        assertEquals("dependency_policy_violation", ErrorType.DEPENDENCY_POLICY_VIOLATION.wireName());
    }
}
