package com.chartboost.core.consent.usercentrics;

import java.util.Objects;

/**
 * When to fire a change notification for a freshly read consent value.
 */
public enum NotificationType {

    /**
     * Fires if the new value differs from the live value held right before the refresh.
     */
    DIFFERENT_FROM_CURRENT_VALUE {
        @Override
        public <T> boolean shouldNotify(T currentValue, T cachedValue, T newValue) {
            return !Objects.equals(currentValue, newValue);
        }
    },

    /**
     * Fires if the new value differs from a baseline captured before the live values were cleared.
     */
    DIFFERENT_FROM_CACHED_VALUE {
        @Override
        public <T> boolean shouldNotify(T currentValue, T cachedValue, T newValue) {
            return !Objects.equals(cachedValue, newValue);
        }
    },

    /**
     * Never fires.
     */
    NEVER {
        @Override
        public <T> boolean shouldNotify(T currentValue, T cachedValue, T newValue) {
            return false;
        }
    };

    public abstract <T> boolean shouldNotify(T currentValue, T cachedValue, T newValue);
}
