package awsTraceDemo;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Makes sure a named table or bucket exists and is usable, creating it when needed.
 * <p>
 * Safe to call repeatedly and from concurrent invocations: an "already exists" answer to the
 * create call counts as success. Waiting for a freshly created resource is bounded by
 * {@code maxWait}; a resource that never turns ACTIVE in time is reported as not ready.
 */
public class ResourceReadiness {

    /**
     * Progress of one ensureExists call.
     */
    public enum State {
        UNCHECKED,
        CHECKING,
        NOT_FOUND,
        CREATING,
        ACTIVE,
        FAILED
    }

    private final ResourceManager manager;
    private final OperationExecutor executor;
    private final OperationLog log;
    private final Duration maxWait;
    private final Duration pollInterval;
    private final Sleeper sleeper;

    public ResourceReadiness(ResourceManager manager, OperationExecutor executor, OperationLog log,
                             Duration maxWait, Duration pollInterval, Sleeper sleeper) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        this.manager = manager;
        this.executor = executor;
        this.log = log;
        this.maxWait = maxWait;
        this.pollInterval = pollInterval;
        this.sleeper = sleeper;
    }

    /**
     * @param name table or bucket name
     * @return true when the resource is ACTIVE on return
     */
    public boolean ensureExists(String name) {
        return resolve(name) == State.ACTIVE;
    }

    /**
     * Runs the readiness state machine to a terminal state.
     *
     * @param name table or bucket name
     * @return {@link State#ACTIVE} or {@link State#FAILED}
     */
    public State resolve(String name) {
        Deadline deadline = Deadline.after(maxWait, executor.getClock());
        State state = transition(name, State.UNCHECKED, State.CHECKING, null);

        ResourceState observed;
        try {
            observed = describe(name);
        } catch (RuntimeException e) {
            return transition(name, state, State.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        switch (observed) {
            case ACTIVE:
                return transition(name, state, State.ACTIVE, null);
            case CREATING:
                state = transition(name, state, State.CREATING, null);
                return awaitActive(name, state, deadline);
            case NOT_FOUND:
                state = transition(name, state, State.NOT_FOUND, null);
                break;
            default:
                return transition(name, state, State.FAILED, "Unusable status " + observed);
        }

        try {
            executor.execute("CREATE_" + manager.resourceType(), name, () -> {
                manager.create(name);
                return null;
            });
        } catch (ResourceAlreadyExistsException e) {
            // someone else created it between our describe and create
            return transition(name, state, State.ACTIVE, "already exists");
        } catch (RuntimeException e) {
            return transition(name, state, State.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        state = transition(name, state, State.CREATING, null);
        return awaitActive(name, state, deadline);
    }

    private State awaitActive(String name, State state, Deadline deadline) {
        while (true) {
            if (deadline.isExpired()) {
                return transition(name, state, State.FAILED, "Not active within " + maxWait.getSeconds() + "s");
            }
            try {
                sleeper.sleep(Math.min(pollInterval.toMillis(), Math.max(1L, deadline.remainingMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return transition(name, state, State.FAILED, "Interrupted while waiting");
            }
            ResourceState observed;
            try {
                observed = describe(name);
            } catch (RuntimeException e) {
                return transition(name, state, State.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (observed == ResourceState.ACTIVE) {
                return transition(name, state, State.ACTIVE, null);
            }
            if (observed == ResourceState.ERROR) {
                return transition(name, state, State.FAILED, "Unusable status " + observed);
            }
            // CREATING, or NOT_FOUND while the create call propagates: keep polling
        }
    }

    private ResourceState describe(String name) {
        return executor.execute("DESCRIBE_" + manager.resourceType(), name, () -> manager.describe(name));
    }

    private State transition(String name, State from, State to, String detail) {
        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put("resource_name", name);
        artifacts.put("aws_service", manager.serviceName());
        artifacts.put("from_state", from.name());
        artifacts.put("to_state", to.name());
        if (detail != null) {
            artifacts.put("detail", detail);
        }
        log.event("Resource_Readiness", to.name(), artifacts);
        return to;
    }
}
