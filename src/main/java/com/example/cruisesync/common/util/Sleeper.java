package com.example.cruisesync.common.util;

/**
 * Indirection over {@link Thread#sleep(long)} so retry loops can be driven by tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
