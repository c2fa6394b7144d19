package awsTraceDemo;

import java.time.Clock;

/**
 * Everything a workflow needs for one invocation. Nothing in here outlives the invocation
 * except the clients, which are shared read-only.
 */
public class InvocationContext {

    private final Configuration conf;
    private final AwsClients clients;
    private final InvocationEvent event;
    private final OperationLog log;
    private final OperationExecutor executor;
    private final TraceRecorder trace;
    private final Clock clock;
    private final Sleeper sleeper;

    public InvocationContext(Configuration conf, AwsClients clients, InvocationEvent event, OperationLog log,
                             TraceRecorder trace, Clock clock, Sleeper sleeper) {
        this.conf = conf;
        this.clients = clients;
        this.event = event;
        this.log = log;
        this.trace = trace;
        this.clock = clock;
        this.sleeper = sleeper;
        this.executor = new OperationExecutor(log, clock);
    }

    /**
     * Readiness checker for one kind of resource, bounded by the configured wait and poll interval.
     */
    public ResourceReadiness readiness(ResourceManager manager) {
        return new ResourceReadiness(manager, executor, log, conf.getResourceWait(), conf.getResourcePollInterval(), sleeper);
    }

    public Configuration getConf() {
        return conf;
    }

    public AwsClients getClients() {
        return clients;
    }

    public InvocationEvent getEvent() {
        return event;
    }

    public OperationLog getLog() {
        return log;
    }

    public OperationExecutor getExecutor() {
        return executor;
    }

    public TraceRecorder getTrace() {
        return trace;
    }

    public Clock getClock() {
        return clock;
    }
}
