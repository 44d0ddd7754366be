package work.dyncall.engine.dependency;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

class DependencyPolicyTest {
    private static final DependencyManifest NOKOGIRI = DependencyManifest.of(new Dependency("nokogiri", "1.16"));

    @Test
    void permissivePolicyAcceptsAnything() {
        assertDoesNotThrow(() -> DependencyPolicy.permissive().enforce(NOKOGIRI));
    }

    @Test
    void allowListRejectsUnlistedNames() {
        DependencyPolicy policy = new DependencyPolicy(List.of("httparty"), List.of(), DependencyPolicy.SourceMode.PUBLIC, List.of());
        DynamicCallException ex = assertThrows(DynamicCallException.class, () -> policy.enforce(NOKOGIRI));
        assertEquals(ErrorType.DEPENDENCY_POLICY_VIOLATION, ex.type());
        assertTrue(ex.getMessage().contains("not in allowed list"));
    }

    @Test
    void blockListWins() {
        DependencyPolicy policy = new DependencyPolicy(null, List.of("nokogiri"), DependencyPolicy.SourceMode.PUBLIC, List.of());
        DynamicCallException ex = assertThrows(DynamicCallException.class, () -> policy.enforce(NOKOGIRI));
        assertTrue(ex.getMessage().contains("blocked"));
    }

    @Test
    void internalOnlyNeedsPrivateSources() {
        DependencyPolicy none = new DependencyPolicy(null, List.of(), DependencyPolicy.SourceMode.INTERNAL_ONLY, List.of());
        DependencyPolicy central = new DependencyPolicy(null, List.of(), DependencyPolicy.SourceMode.INTERNAL_ONLY,
            List.of("https://repo.maven.apache.org/maven2"));
        DependencyPolicy internal = new DependencyPolicy(null, List.of(), DependencyPolicy.SourceMode.INTERNAL_ONLY,
            List.of("https://nexus.internal.example/repository/libs"));

        assertThrows(DynamicCallException.class, () -> none.enforce(NOKOGIRI));
        assertThrows(DynamicCallException.class, () -> central.enforce(NOKOGIRI));
        assertDoesNotThrow(() -> internal.enforce(NOKOGIRI));
    }

    @Test
    void emptyManifestSkipsPolicy() {
        DependencyPolicy none = new DependencyPolicy(null, List.of(), DependencyPolicy.SourceMode.INTERNAL_ONLY, List.of());
        assertDoesNotThrow(() -> none.enforce(DependencyManifest.empty()));
    }

    @Test
    void sourceModeParsing() {
        assertEquals(DependencyPolicy.SourceMode.INTERNAL_ONLY, DependencyPolicy.SourceMode.from("INTERNAL_ONLY"));
        assertEquals(DependencyPolicy.SourceMode.PUBLIC, DependencyPolicy.SourceMode.from(null));
    }
}
