package work.dyncall.engine.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CapabilityPatternsTest {
    @Test
    void fetchAndToolCallsAreTagged() {
        Map<String, List<String>> evidence = CapabilityPatterns.evidence(
            "const page = api.tool('web_fetcher').call('get', [args[0]]); return page;");

        assertEquals(List.of("web_fetcher_tool_call"), evidence.get("http_fetch"));
        assertEquals(List.of("http_fetch"), CapabilityPatterns.labels("return fetch(args[0]);"));
    }

    @Test
    void headlineExtractionNeedsIterationTitleAndLink() {
        String code = "const doc = new DOMParser().parseFromString(args[0], 'text/xml');\n"
            + "return items.map(item => ({title: item.title, link: item.link}));";

        List<String> labels = CapabilityPatterns.labels(code);

        assertEquals(List.of("xml_parse", CapabilityPatterns.NEWS_HEADLINE_EXTRACT), labels);
        assertTrue(CapabilityPatterns.labels("return items.map(item => item.title);").isEmpty());
    }

    @Test
    void blankOrPlainCodeHasNoPatterns() {
        assertTrue(CapabilityPatterns.labels(null).isEmpty());
        assertTrue(CapabilityPatterns.labels("  ").isEmpty());
        assertTrue(CapabilityPatterns.labels("context.value = (context.value || 0) + 1; return context.value;").isEmpty());
    }
}
