package com.activitytracker.sampling;

import java.util.Optional;

public interface ForegroundSampler extends AutoCloseable {

    /**
     * @return the foreground window, or empty when no attributable window has focus
     */
    Optional<WindowSnapshot> sample() throws SamplingException;

    @Override
    default void close() {
        // default noop
    }
}
