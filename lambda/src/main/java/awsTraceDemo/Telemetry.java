package awsTraceDemo;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;

import java.util.Map;

/**
 * Builds the OpenTelemetry SDK the function reports its spans through: OTLP over HTTP to
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT} (the local collector or extension by default), batched and
 * flushed by the handler at the end of every invocation.
 */
public final class Telemetry {

    static final String INSTRUMENTATION_NAME = "awsTraceDemo";
    static final String DEFAULT_ENDPOINT = "http://localhost:4318";
    static final String DEFAULT_SERVICE_NAME = "aws-trace-demo";

    private Telemetry() {
    }

    /**
     * @param environment variables to read OTEL_EXPORTER_OTLP_ENDPOINT and OTEL_SERVICE_NAME from
     */
    public static OpenTelemetrySdk create(Map<String, String> environment) {
        String endpoint = environment.getOrDefault("OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
        if (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }
        String serviceName = environment.getOrDefault("OTEL_SERVICE_NAME",
                environment.getOrDefault("AWS_LAMBDA_FUNCTION_NAME", DEFAULT_SERVICE_NAME));

        Resource resource = Resource.getDefault().toBuilder()
                .put(AttributeKey.stringKey("service.name"), serviceName)
                .build();

        OtlpHttpSpanExporter spanExporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint + "/v1/traces")
                .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setResource(resource)
                .build();

        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
    }

    /**
     * The process-wide SDK, built from the process environment and registered as the global
     * instance on first use.
     */
    static OpenTelemetrySdk global() {
        return Holder.SDK;
    }

    private static final class Holder {
        private static final OpenTelemetrySdk SDK = register();

        private static OpenTelemetrySdk register() {
            OpenTelemetrySdk sdk = create(System.getenv());
            GlobalOpenTelemetry.set(sdk);
            return sdk;
        }
    }
}
