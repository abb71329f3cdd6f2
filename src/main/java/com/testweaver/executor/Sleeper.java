package com.testweaver.executor;

/**
 * Pauses the executing thread. Injected so tests can run without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
