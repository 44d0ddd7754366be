package work.dyncall.engine.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic capability tags for a program, derived from its source alone. Each label maps to the
 * signals that matched, so a tag can always be traced back to the code that produced it.
 */
public final class CapabilityPatterns {
    public static final String NEWS_HEADLINE_EXTRACT = "news_headline_extract";

    private static final Map<String, Map<String, Pattern>> SIGNALS = new LinkedHashMap<>();

    static {
        signal("rss_parse", "rss_item_markup", "<item\\b");
        signal("rss_parse", "rss_channel_markup", "<channel\\b|\\brss\\s*\\.\\s*channel\\b");
        signal("xml_parse", "dom_parser", "\\bDOMParser\\b");
        signal("xml_parse", "xml_mime_type", "[\"'](?:text|application)/xml[\"']");
        signal("http_fetch", "fetch_call", "(?<![\\w$.])fetch\\s*\\(");
        signal("http_fetch", "web_fetcher_tool_call", "\\btool\\s*\\(\\s*[\"']web_fetcher[\"']\\s*\\)");
        signal("http_fetch", "web_fetcher_delegate_call", "\\bdelegate\\s*\\(\\s*[\"']web_fetcher[\"']\\s*[,)]");
        signal("html_extract", "jsoup_parse", "\\bJsoup\\s*\\.\\s*parse\\b|org\\.jsoup\\.");
        signal("html_extract", "html_anchor_scan", "(?:match|matchAll|exec)\\s*\\(\\s*/.*<a\\b.*/[dgimsuy]*\\s*\\)");
        signal("html_extract", "html_heading_scan", "(?:match|matchAll|exec)\\s*\\(\\s*/.*<h[1-6]\\b.*/[dgimsuy]*\\s*\\)");
    }

    private static final Pattern ITERATION = Pattern.compile("\\.(?:map|forEach|flatMap|reduce)\\s*\\(|\\bfor\\s*\\(\\s*(?:const|let|var)\\s+\\w+\\s+of\\b");
    private static final Pattern TITLE = Pattern.compile("\\btitle\\s*:|[\"']title[\"']\\s*[:\\]]|\\.title\\b");
    private static final Pattern LINK = Pattern.compile("\\blink\\s*:|[\"']link[\"']\\s*[:\\]]|\\.link\\b");

    private CapabilityPatterns() {}

    private static void signal(String label, String name, String regex) {
        SIGNALS.computeIfAbsent(label, key -> new LinkedHashMap<>()).put(name, Pattern.compile(regex));
    }

    /** Label to matched signal names, in a stable order. Empty for blank code. */
    public static Map<String, List<String>> evidence(String code) {
        Map<String, List<String>> evidence = new LinkedHashMap<>();
        if (code == null || code.isBlank()) {
            return evidence;
        }
        SIGNALS.forEach((label, checks) -> {
            List<String> matched = new ArrayList<>();
            checks.forEach((name, pattern) -> {
                if (pattern.matcher(code).find()) {
                    matched.add(name);
                }
            });
            if (!matched.isEmpty()) {
                evidence.put(label, matched);
            }
        });
        if (ITERATION.matcher(code).find() && TITLE.matcher(code).find() && LINK.matcher(code).find()) {
            evidence.put(NEWS_HEADLINE_EXTRACT, List.of("iterates_collection_and_extracts_title_and_link"));
        }
        return evidence;
    }

    public static List<String> labels(String code) {
        return new ArrayList<>(evidence(code).keySet());
    }
}
