package com.chartboost.core.consent.usercentrics;

import com.chartboost.core.consent.ConsentStatus;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Immutable copy of the adapter's consent state, used as the baseline for
 * {@link NotificationType#DIFFERENT_FROM_CACHED_VALUE}.
 */
@Value(staticConstructor = "of")
public class ConsentSnapshot {

    public static final ConsentSnapshot EMPTY =
            ConsentSnapshot.of(Collections.emptyMap(), Collections.emptyMap(), ConsentStatus.UNKNOWN);

    Map<String, String> consents;

    Map<String, ConsentStatus> partnerConsents;

    ConsentStatus consentStatus;

    public String consent(String key) {
        return consents.get(key);
    }

    public ConsentStatus partnerConsent(String partnerId) {
        return partnerConsents.getOrDefault(partnerId, ConsentStatus.UNKNOWN);
    }
}
