package awsTraceDemo;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SdkTracerProvider;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Lambda entry point. Runs the API, S3, DynamoDB and PostgreSQL categories against round-robin
 * resources inside one span, tagging the span as it goes.
 * <p>
 * Each category is contained: its failure becomes an error entry in the body and a programmatic error
 * on the span, and the response stays 200. Only a failure outside every category, such as a malformed
 * event, turns the response into a 500.
 */
public class Handler implements RequestHandler<Map<String, Object>, Map<String, Object>> {

    static final String SUCCESS_MESSAGE = "Lambda function executed successfully";

    static final long FLUSH_TIMEOUT_SECONDS = 5;

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final Configuration conf;
    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;
    private final Clock clock;
    private final Sleeper sleeper;
    private final List<CategoryWorkflow> workflows;
    private AwsClients clients;

    public Handler() {
        this(new Configuration(), null, Telemetry.global().getSdkTracerProvider(), Clock.systemUTC(), Sleeper.THREAD);
    }

    /**
     * @param clients service clients, or null to build them from the configuration on first use
     * @param tracerProvider source of the invocation span, flushed before each response is returned
     */
    Handler(Configuration conf, AwsClients clients, SdkTracerProvider tracerProvider, Clock clock, Sleeper sleeper) {
        this(conf, clients, tracerProvider, clock, sleeper,
                List.of(new ApiWorkflow(), new S3Workflow(), new DynamoDbWorkflow(), new RdsWorkflow()));
    }

    Handler(Configuration conf, AwsClients clients, SdkTracerProvider tracerProvider, Clock clock, Sleeper sleeper,
            List<CategoryWorkflow> workflows) {
        this.conf = conf;
        this.clients = clients;
        this.tracerProvider = tracerProvider;
        this.tracer = tracerProvider.get(Telemetry.INSTRUMENTATION_NAME);
        this.clock = clock;
        this.sleeper = sleeper;
        this.workflows = workflows;
    }

    @Override
    public Map<String, Object> handleRequest(Map<String, Object> event, Context context) {
        Span span = tracer.spanBuilder(context.getFunctionName() != null ? context.getFunctionName() : "awsTraceDemo.Handler")
                .setSpanKind(SpanKind.SERVER)
                .setAttribute("faas.invocation_id", String.valueOf(context.getAwsRequestId()))
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            return handle(event, context, span);
        } finally {
            span.end();
            flush(context);
        }
    }

    //the execution environment may be frozen right after the response, so nothing is left in the batch
    private void flush(Context context) {
        CompletableResultCode result = tracerProvider.forceFlush().join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            context.getLogger().log("Span export did not complete within " + FLUSH_TIMEOUT_SECONDS + "s");
        }
    }

    private Map<String, Object> handle(Map<String, Object> event, Context context, Span span) {
        OperationLog log = new OperationLog(context.getLogger());
        TraceRecorder trace = new OpenTelemetryTraceRecorder(log);
        String requestId = context.getAwsRequestId();
        try {
            log.log("INPUT: " + GSON.toJson(event));
            InvocationEvent parsed = InvocationEvent.parse(event);
            for (Map.Entry<String, String> tag : parsed.tags().entrySet()) {
                trace.addExecutionTag(tag.getKey(), tag.getValue());
            }

            InvocationContext ctx = new InvocationContext(conf, clients(), parsed, log, trace, clock, sleeper);
            CategoryRunner runner = new CategoryRunner(conf.isRunCategoriesConcurrently(), conf.getCategoryTimeout());
            Map<String, Object> categories = runner.run(workflows, ctx);

            String result = parsed.processedResult();
            trace.addExecutionTag("business_logic_result", result);
            trace.addExecutionTag("processing_status", "completed");

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", SUCCESS_MESSAGE);
            body.putAll(categories);
            body.put("result", result);
            body.put("request_id", requestId);
            return response(200, body);
        } catch (RuntimeException e) {
            String message = "Lambda execution failed: " + e.getMessage();
            log.log(message);
            trace.addExecutionTag("processing_status", "failed");
            trace.addExecutionTag("error_type", e.getClass().getSimpleName());

            Map<String, String> details = new LinkedHashMap<>();
            details.put("error_type", e.getClass().getSimpleName());
            details.put("function_name", String.valueOf(context.getFunctionName()));
            details.put("request_id", String.valueOf(requestId));
            trace.addProgrammaticError("LAMBDA_EXECUTION_FAILED", message, details);
            span.setStatus(StatusCode.ERROR, message);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", message);
            body.put("request_id", requestId);
            return response(500, body);
        }
    }

    private AwsClients clients() {
        if (clients == null) {
            clients = AwsClients.create(conf);
        }
        return clients;
    }

    private static Map<String, Object> response(int statusCode, Map<String, Object> body) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("statusCode", statusCode);
        response.put("body", GSON.toJson(body));
        return response;
    }
}
