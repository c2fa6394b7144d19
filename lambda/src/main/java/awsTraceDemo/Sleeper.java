package awsTraceDemo;

/**
 * Pause between polls. Swapped for a fake clock-advancing sleeper in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
