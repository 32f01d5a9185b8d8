package com.chartboost.core.consent.usercentrics;

import com.chartboost.core.consent.ConsentAdapterListener;
import com.chartboost.core.consent.ConsentStatus;
import com.chartboost.core.util.SafeExecutor;

public class ConsentNotifier {

    private volatile ConsentAdapterListener listener;

    public ConsentAdapterListener getListener() {
        return listener;
    }

    public void setListener(ConsentAdapterListener listener) {
        this.listener = listener;
    }

    public void consentChanged(String standard) {
        final ConsentAdapterListener currentListener = listener;
        if (currentListener != null) {
            SafeExecutor.execute(() -> currentListener.onConsentChange(standard));
        }
    }

    public void consentStatusChanged(ConsentStatus status) {
        final ConsentAdapterListener currentListener = listener;
        if (currentListener != null) {
            SafeExecutor.execute(() -> currentListener.onConsentStatusChange(status));
        }
    }
}
