package work.dyncall.engine.observability;

import java.io.IOException;

/**
 * Destination for call records. A failing sink never changes the outcome of the call it describes.
 */
@FunctionalInterface
public interface CallRecordSink {
    void emit(CallRecord record) throws IOException;
}
