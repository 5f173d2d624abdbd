package com.infrakit.synth.deploy;

import java.time.Duration;

/**
 * Waits between two status polls.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
