package awsTraceDemo;

import java.time.Clock;

/**
 * Runs a single external call between a start and an end record.
 * The record always reaches the sink; the call's failure, if any, always reaches the caller.
 */
public class OperationExecutor {

    /**
     * An external call. May throw checked exceptions (JDBC, IO).
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface Operation<T> {
        T call() throws Exception;
    }

    private final OperationSink sink;
    private final Clock clock;

    public OperationExecutor(OperationSink sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
    }

    /**
     * Invokes the operation and emits its record.
     *
     * @param operationKind e.g. PUT_OBJECT
     * @param resourceName bucket, table or endpoint the call targets
     * @param operation the call itself
     * @return whatever the call returned
     * @throws OperationFailedException wrapping a checked exception thrown by the call
     */
    public <T> T execute(String operationKind, String resourceName, Operation<T> operation) {
        OperationRecord.Pending pending = OperationRecord.start(operationKind, resourceName, clock);
        T result;
        try {
            result = operation.call();
        } catch (RuntimeException e) {
            sink.emit(pending.failed(e));
            throw e;
        } catch (Exception e) {
            sink.emit(pending.failed(e));
            throw new OperationFailedException(operationKind + " on " + resourceName + " failed: " + e.getMessage(), e);
        } catch (Error e) {
            sink.emit(pending.failed(e));
            throw e;
        }
        sink.emit(pending.succeeded());
        return result;
    }

    /**
     * Records an operation that was deliberately not performed.
     *
     * @param operationKind e.g. DELETE_ITEM
     * @param resourceName target that was left alone
     * @param reason why
     * @return the emitted record
     */
    public OperationRecord skip(String operationKind, String resourceName, String reason) {
        OperationRecord record = OperationRecord.start(operationKind, resourceName, clock).skipped(reason);
        sink.emit(record);
        return record;
    }

    public Clock getClock() {
        return clock;
    }
}
