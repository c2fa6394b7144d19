package awsTraceDemo;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes operation records and workflow milestones to the Lambda log as one JSON document per line.
 * Milestones use the Data_Source / Data_Target / Data_Artifacts envelope so that a log query
 * can follow data from the handler down to each service call.
 */
public class OperationLog implements OperationSink {

    static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .create();

    private final LambdaLogger logger;

    public OperationLog(LambdaLogger logger) {
        this.logger = logger;
    }

    @Override
    public void emit(OperationRecord record) {
        logger.log(GSON.toJson(record));
    }

    /**
     * Logs a milestone in the flow of data.
     *
     * @param source where the data comes from, e.g. Lambda_Handler
     * @param target where it goes, e.g. S3_Operations
     * @param artifacts anything worth searching for later
     */
    public void event(String source, String target, Map<String, ?> artifacts) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("Data_Source", source);
        entry.put("Data_Target", target);
        entry.put("Data_Artifacts", artifacts);
        logger.log(GSON.toJson(entry));
    }

    /**
     * Plain text line, for the odd message that has no structure.
     */
    public void log(String message) {
        logger.log(message);
    }

    public LambdaLogger getLogger() {
        return logger;
    }
}
