package com.autorestake.service;

import java.time.Duration;

/** Delay between retry attempts; swapped out in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
