package com.shortlink.common;

/**
 * Blocking pause between retry attempts. Injected so retry loops can be tested without real waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
