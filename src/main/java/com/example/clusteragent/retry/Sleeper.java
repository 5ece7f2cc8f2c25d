package com.example.clusteragent.retry;

/**
 * Abstraction over {@link Thread#sleep(long)} so retry timing can be observed in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
