package com.carescore.resilience;

/**
 * Blocking pause between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
