package awsTraceDemo;

/**
 * Receives finalized operation records.
 */
public interface OperationSink {

    void emit(OperationRecord record);
}
