package work.dyncall.engine.guardrail;

import java.util.regex.Pattern;

final class ExternalDataFlow {
    static final Pattern FETCH_LIKE = Pattern.compile(
        "\\bfetch\\s*\\(|XMLHttpRequest|java\\.net\\.http|tool\\(\\s*[\"']web_fetcher[\"']\\s*\\)|fetch_result",
        Pattern.CASE_INSENSITIVE);
    static final Pattern EXTERNAL_SOURCE = Pattern.compile(
        "tool\\(\\s*[\"'][\\w-]*fetch[\\w-]*[\"']\\s*\\)"
            + "|delegate\\(\\s*[\"'][\\w-]*fetch[\\w-]*[\"']\\s*[,)]"
            + "|\\bfetch\\s*\\("
            + "|java\\.net\\.http",
        Pattern.CASE_INSENSITIVE);

    private ExternalDataFlow() {}
}
