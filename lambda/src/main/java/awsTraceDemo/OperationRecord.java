package awsTraceDemo;

import com.google.gson.annotations.SerializedName;

import java.time.Clock;
import java.time.Instant;

/**
 * One data-access attempt: what was called, against which resource, and how it ended.
 * Instances are only produced by {@link Pending}, which finalizes exactly once.
 */
public final class OperationRecord {

    public enum Status {
        @SerializedName("success") SUCCESS,
        @SerializedName("failure") FAILURE,
        @SerializedName("skipped") SKIPPED
    }

    public enum ErrorKind {
        @SerializedName("timeout") TIMEOUT,
        @SerializedName("failure") FAILURE
    }

    private final String operationKind;
    private final String resourceName;
    private final Status status;
    private final String errorDetail;
    private final String errorType;
    private final ErrorKind errorKind;
    // ISO-8601, kept as text so the record serializes without java.time adapters
    private final String timestamp;
    private final long durationMs;

    private OperationRecord(Pending pending, Status status, Throwable error, String detail, long durationMs) {
        this.operationKind = pending.operationKind;
        this.resourceName = pending.resourceName;
        this.timestamp = pending.startedAt.toString();
        this.status = status;
        this.durationMs = durationMs;
        if (error != null) {
            this.errorDetail = detail != null ? detail : String.valueOf(error.getMessage());
            this.errorType = error.getClass().getSimpleName();
            this.errorKind = isTimeout(error) ? ErrorKind.TIMEOUT : ErrorKind.FAILURE;
        } else {
            this.errorDetail = detail;
            this.errorType = null;
            this.errorKind = null;
        }
    }

    /**
     * Opens a record for an attempt that starts now.
     *
     * @param operationKind e.g. PUT_ITEM, HEAD_BUCKET
     * @param resourceName table, bucket or endpoint
     * @param clock time source
     * @return the pending record
     */
    public static Pending start(String operationKind, String resourceName, Clock clock) {
        return new Pending(operationKind, resourceName, clock);
    }

    /**
     * Walks the cause chain looking for anything that means "ran out of time".
     */
    static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof OperationTimeoutException
                    || current instanceof java.io.InterruptedIOException
                    || current instanceof java.sql.SQLTimeoutException
                    || current instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    public String getOperationKind() {
        return operationKind;
    }

    public String getResourceName() {
        return resourceName;
    }

    public Status getStatus() {
        return status;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public String getErrorType() {
        return errorType;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public long getDurationMs() {
        return durationMs;
    }

    /**
     * An attempt in flight.
     */
    public static final class Pending {
        private final String operationKind;
        private final String resourceName;
        private final Clock clock;
        private final Instant startedAt;
        private boolean finalized;

        private Pending(String operationKind, String resourceName, Clock clock) {
            this.operationKind = operationKind;
            this.resourceName = resourceName;
            this.clock = clock;
            this.startedAt = clock.instant();
        }

        public OperationRecord succeeded() {
            return finish(Status.SUCCESS, null, null);
        }

        public OperationRecord failed(Throwable error) {
            return finish(Status.FAILURE, error, null);
        }

        public OperationRecord skipped(String reason) {
            return finish(Status.SKIPPED, null, reason);
        }

        private synchronized OperationRecord finish(Status status, Throwable error, String detail) {
            if (finalized) {
                throw new IllegalStateException("Operation record for " + operationKind + " on " + resourceName
                        + " is already finalized");
            }
            finalized = true;
            long elapsed = clock.millis() - startedAt.toEpochMilli();
            return new OperationRecord(this, status, error, detail, Math.max(0L, elapsed));
        }
    }
}
