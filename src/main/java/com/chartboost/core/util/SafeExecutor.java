package com.chartboost.core.util;

import com.chartboost.core.log.Logger;
import com.chartboost.core.log.LoggerFactory;

/**
 * Runs code supplied by integrators so that its failures never break the caller's flow.
 */
public final class SafeExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SafeExecutor.class);

    private SafeExecutor() {
    }

    /**
     * Runs the given action, logging and discarding anything it throws.
     *
     * @return {@code true} if the action completed normally
     */
    public static boolean execute(Runnable action) {
        try {
            action.run();
            return true;
        } catch (Exception e) {
            logger.warn("Exception raised by callback: {}", e, e.getMessage());
            return false;
        }
    }
}
