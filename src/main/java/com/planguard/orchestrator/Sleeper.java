package com.planguard.orchestrator;

/**
 * Backoff pause between generation retries. Tests substitute a recording
 * implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
