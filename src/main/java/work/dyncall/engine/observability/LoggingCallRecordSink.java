package work.dyncall.engine.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingCallRecordSink implements CallRecordSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingCallRecordSink.class);

    @Override
    public void emit(CallRecord record) {
        if ("ok".equals(record.status())) {
            log.info("{}.{} ok depth={} attempt={} source={} {}ms", record.role(), record.method(), record.get("depth"),
                record.get("attempt_id"), record.get("program_source"), record.get("duration_ms"));
        } else {
            log.info("{}.{} error [{}] {} depth={} attempt={} source={} {}ms", record.role(), record.method(),
                record.get("outcome_error_type"), record.get("outcome_error_message"), record.get("depth"),
                record.get("attempt_id"), record.get("program_source"), record.get("duration_ms"));
        }
    }
}
