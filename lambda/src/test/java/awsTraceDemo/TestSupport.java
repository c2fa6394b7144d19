package awsTraceDemo;

import com.amazonaws.services.lambda.runtime.ClientContext;
import com.amazonaws.services.lambda.runtime.CognitoIdentity;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fakes shared by the tests: a settable clock, a Lambda context whose logger keeps every line,
 * and a trace recorder that remembers what it was given.
 */
final class TestSupport {

    private TestSupport() {
    }

    static OperationLog operationLog(CapturingLogger logger) {
        return new OperationLog(logger);
    }

    static final class MutableClock extends Clock {
        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        static MutableClock atEpochSecond(long epochSecond) {
            return new MutableClock(epochSecond * 1000L);
        }

        synchronized void advance(long deltaMillis) {
            millis += deltaMillis;
        }

        @Override
        public synchronized long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }

    static final class CapturingLogger implements LambdaLogger {
        private final List<String> lines = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void log(String message) {
            lines.add(message);
        }

        @Override
        public void log(byte[] message) {
            lines.add(new String(message, StandardCharsets.UTF_8));
        }

        List<String> lines() {
            synchronized (lines) {
                return new ArrayList<>(lines);
            }
        }

        boolean contains(String fragment) {
            return lines().stream().anyMatch(line -> line.contains(fragment));
        }
    }

    static final class TestContext implements Context {
        private final CapturingLogger logger = new CapturingLogger();

        CapturingLogger logger() {
            return logger;
        }

        @Override
        public String getAwsRequestId() {
            return "req-495b12a8";
        }

        @Override
        public String getLogGroupName() {
            return "/aws/lambda/aws-trace-demo";
        }

        @Override
        public String getLogStreamName() {
            return "2026/10/19/[$LATEST]0123456789abcdef";
        }

        @Override
        public String getFunctionName() {
            return "aws-trace-demo";
        }

        @Override
        public String getFunctionVersion() {
            return "$LATEST";
        }

        @Override
        public String getInvokedFunctionArn() {
            return "arn:aws:lambda:us-east-1:123456789012:function:aws-trace-demo";
        }

        @Override
        public CognitoIdentity getIdentity() {
            return null;
        }

        @Override
        public ClientContext getClientContext() {
            return null;
        }

        @Override
        public int getRemainingTimeInMillis() {
            return 30000;
        }

        @Override
        public int getMemoryLimitInMB() {
            return 512;
        }

        @Override
        public LambdaLogger getLogger() {
            return logger;
        }
    }

    static final class RecordingTraceRecorder implements TraceRecorder {
        final Map<String, String> tags = Collections.synchronizedMap(new LinkedHashMap<>());
        final List<String> errorTypes = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void addExecutionTag(String key, String value) {
            tags.put(key, value);
        }

        @Override
        public void addProgrammaticError(String errorType, String message, Map<String, String> details) {
            errorTypes.add(errorType);
        }
    }
}
