package awsTraceDemo;

import io.opentelemetry.context.Context;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the enabled categories and collects one result per category. A category that throws, or
 * overruns its timeout when running concurrently, gets an error result and a programmatic error;
 * the others are unaffected.
 */
public class CategoryRunner {

    private final boolean concurrent;
    private final Duration categoryTimeout;

    public CategoryRunner(boolean concurrent, Duration categoryTimeout) {
        this.concurrent = concurrent;
        this.categoryTimeout = categoryTimeout;
    }

    /**
     * @return result per workflow, keyed by {@link CategoryWorkflow#resultKey()}, in workflow order
     */
    public Map<String, Object> run(List<CategoryWorkflow> workflows, InvocationContext ctx) {
        Map<String, Object> results = new LinkedHashMap<>();
        if (!concurrent) {
            for (CategoryWorkflow workflow : workflows) {
                results.put(workflow.resultKey(), runContained(workflow, ctx));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, workflows.size()));
        try {
            Map<CategoryWorkflow, Future<Map<String, Object>>> futures = new LinkedHashMap<>();
            Deadline deadline = Deadline.after(categoryTimeout, ctx.getClock());
            for (CategoryWorkflow workflow : workflows) {
                Callable<Map<String, Object>> task = () -> runContained(workflow, ctx);
                //keep the invocation span current on the worker thread
                futures.put(workflow, pool.submit(Context.current().wrap(task)));
            }
            for (Map.Entry<CategoryWorkflow, Future<Map<String, Object>>> entry : futures.entrySet()) {
                results.put(entry.getKey().resultKey(), await(entry.getKey(), entry.getValue(), deadline, ctx));
            }
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private Map<String, Object> await(CategoryWorkflow workflow, Future<Map<String, Object>> future, Deadline deadline,
                                      InvocationContext ctx) {
        try {
            return future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(workflow, ctx, new OperationTimeoutException(
                    workflow.category() + " exceeded " + categoryTimeout.toMillis() + "ms"));
        } catch (ExecutionException e) {
            return failed(workflow, ctx, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(workflow, ctx, e);
        }
    }

    private Map<String, Object> runContained(CategoryWorkflow workflow, InvocationContext ctx) {
        if (!ctx.getEvent().isEnabled(workflow.category())) {
            Map<String, Object> skipped = new LinkedHashMap<>();
            skipped.put("status", "skipped");
            skipped.put("reason", workflow.category() + " disabled in event actions");
            return skipped;
        }
        try {
            return workflow.run(ctx);
        } catch (RuntimeException | Error e) {
            //same set of failures a pooled task reports through ExecutionException
            return failed(workflow, ctx, e);
        }
    }

    private static Map<String, Object> failed(CategoryWorkflow workflow, InvocationContext ctx, Throwable error) {
        String message = String.valueOf(error.getMessage());
        String errorType = error.getClass().getSimpleName();

        Map<String, String> details = new LinkedHashMap<>();
        details.put("category", workflow.category());
        details.put("error_type", errorType);
        details.put("error_kind", OperationRecord.isTimeout(error) ? "timeout" : "failure");
        ctx.getTrace().addProgrammaticError(workflow.errorType(), message, details);

        Map<String, Object> artifacts = new LinkedHashMap<>(details);
        artifacts.put("error", message);
        ctx.getLog().event(workflow.category(), "Lambda_Handler", artifacts);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "error");
        result.put("error", message);
        result.put("error_type", errorType);
        return result;
    }
}
