package com.chartboost.core.consent.usercentrics;

import com.chartboost.core.consent.ConsentStandard;
import com.chartboost.core.consent.ConsentStatus;
import com.chartboost.core.consent.ConsentValue;
import com.chartboost.core.consent.usercentrics.sdk.CcpaData;
import com.chartboost.core.consent.usercentrics.sdk.TcfData;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsReadyStatus;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsSdk;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsServiceConsent;
import com.chartboost.core.log.Logger;
import com.chartboost.core.log.LoggerFactory;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the adapter's consent state and brings it in line with what the Usercentrics SDK reports.
 * <p>
 * State is written only from the main context. Every key is diffed on its own, so the listener hears
 * about each changed key exactly once per refresh.
 */
public class ConsentReconciler {

    private static final Logger logger = LoggerFactory.getLogger(ConsentReconciler.class);

    public static final String DEFAULT_CORE_DPS_NAME = "ChartboostCore";

    private final UsercentricsSdk usercentricsSdk;
    private final Context mainContext;
    private final ConsentNotifier notifier;

    private final Map<String, String> consents = new ConcurrentHashMap<>();
    private final Map<String, String> consentsView = Collections.unmodifiableMap(consents);
    private final Map<String, ConsentStatus> partnerConsentStatus = new ConcurrentHashMap<>();

    private volatile ConsentStatus consentStatus = ConsentStatus.UNKNOWN;
    private volatile boolean shouldCollectConsent = true;

    private volatile String coreDpsName = DEFAULT_CORE_DPS_NAME;
    private volatile PartnerIdResolver partnerIdResolver = PartnerIdResolver.defaults();

    public ConsentReconciler(UsercentricsSdk usercentricsSdk, Context mainContext, ConsentNotifier notifier) {
        this.usercentricsSdk = Objects.requireNonNull(usercentricsSdk);
        this.mainContext = Objects.requireNonNull(mainContext);
        this.notifier = Objects.requireNonNull(notifier);
    }

    public Map<String, String> consents() {
        return consentsView;
    }

    public ConsentStatus consentStatus() {
        return consentStatus;
    }

    public boolean shouldCollectConsent() {
        return shouldCollectConsent;
    }

    public String getCoreDpsName() {
        return coreDpsName;
    }

    public void setCoreDpsName(String coreDpsName) {
        this.coreDpsName = StringUtils.defaultIfBlank(coreDpsName, DEFAULT_CORE_DPS_NAME);
    }

    public PartnerIdResolver getPartnerIdResolver() {
        return partnerIdResolver;
    }

    public void setPartnerIdResolver(PartnerIdResolver partnerIdResolver) {
        this.partnerIdResolver = Objects.requireNonNull(partnerIdResolver);
    }

    public ConsentSnapshot snapshot() {
        return ConsentSnapshot.of(Map.copyOf(consents), Map.copyOf(partnerConsentStatus), consentStatus);
    }

    /**
     * Reads every tracked representation from the SDK and applies it. The returned future completes once
     * the asynchronous TCF read has been applied too.
     */
    public Future<Void> refresh(UsercentricsReadyStatus readyStatus,
                                NotificationType notify,
                                ConsentSnapshot cachedSnapshot) {

        shouldCollectConsent = readyStatus.isShouldCollectConsent();

        final List<UsercentricsServiceConsent> serviceConsents = readyStatus.getConsents() != null
                ? readyStatus.getConsents()
                : Collections.emptyList();
        updateConsentStatus(serviceConsents, notify, cachedSnapshot);
        updatePartnerConsents(serviceConsents, notify, cachedSnapshot);

        final CcpaData ccpaData = usercentricsSdk.getUspData();
        updateCcpaOptIn(ccpaData != null ? ccpaData.getOptedOut() : null, notify, cachedSnapshot);
        updateUsp(ccpaData != null ? ccpaData.getUspString() : null, notify, cachedSnapshot);

        return fetchTcfData()
                .map(tcfData -> {
                    updateTcf(tcfData != null ? tcfData.getTcString() : null, notify, cachedSnapshot);
                    return null;
                });
    }

    /**
     * Drops all consent state without notifying, as done right before the SDK is reset.
     */
    public void clear() {
        consentStatus = ConsentStatus.UNKNOWN;
        consents.clear();
        partnerConsentStatus.clear();
    }

    /**
     * Drops all consent state, reporting every known key as gone and the consent status as unknown.
     */
    public void clearAndNotify() {
        clearAndNotify(ConsentSnapshot.EMPTY);
    }

    /**
     * Same as {@link #clearAndNotify()}, also reporting the keys of a baseline captured before the live
     * state was cleared.
     */
    public void clearAndNotify(ConsentSnapshot baseline) {
        consentStatus = ConsentStatus.UNKNOWN;
        final Set<String> removedKeys = new LinkedHashSet<>(baseline.getConsents().keySet());
        removedKeys.addAll(consents.keySet());
        consents.clear();
        partnerConsentStatus.clear();

        removedKeys.forEach(notifier::consentChanged);
        notifier.consentStatusChanged(ConsentStatus.UNKNOWN);
    }

    private Future<TcfData> fetchTcfData() {
        final Promise<TcfData> promise = Promise.promise();
        usercentricsSdk.getTcfData(tcfData -> mainContext.runOnContext(ignored -> {
            if (!promise.tryComplete(tcfData)) {
                logger.debug("Ignoring repeated TCF data callback");
            }
        }));
        return promise.future();
    }

    private void updateConsentStatus(List<UsercentricsServiceConsent> serviceConsents,
                                     NotificationType notify,
                                     ConsentSnapshot cachedSnapshot) {

        final String dpsName = coreDpsName;
        final ConsentStatus newConsentStatus = serviceConsents.stream()
                .filter(serviceConsent -> Objects.equals(serviceConsent.getDataProcessor(), dpsName))
                .findFirst()
                .map(serviceConsent -> ConsentStatus.of(serviceConsent.isStatus()))
                .orElse(ConsentStatus.UNKNOWN);

        final ConsentStatus previousConsentStatus = consentStatus;
        consentStatus = newConsentStatus;
        logger.debug("Setting consent status to {}", newConsentStatus);

        if (notify.shouldNotify(previousConsentStatus, cachedSnapshot.getConsentStatus(), newConsentStatus)) {
            notifier.consentStatusChanged(newConsentStatus);
        }
    }

    private void updatePartnerConsents(List<UsercentricsServiceConsent> serviceConsents,
                                       NotificationType notify,
                                       ConsentSnapshot cachedSnapshot) {

        final PartnerIdResolver resolver = partnerIdResolver;
        final Map<String, ConsentStatus> newPartnerConsents = new HashMap<>();
        for (UsercentricsServiceConsent serviceConsent : serviceConsents) {
            final String partnerId = resolver.resolve(serviceConsent.getTemplateId());
            if (ConsentStandard.isStandard(partnerId)) {
                logger.warn("Skipping consent of {}: partner id {} clashes with a consent standard",
                        serviceConsent.getTemplateId(), partnerId);
            } else if (StringUtils.isNotEmpty(partnerId)) {
                newPartnerConsents.put(partnerId, ConsentStatus.of(serviceConsent.isStatus()));
            }
        }

        newPartnerConsents.forEach((partnerId, newStatus) ->
                updatePartnerConsent(partnerId, newStatus, notify, cachedSnapshot));

        final Set<String> droppedPartnerIds = new HashSet<>(partnerConsentStatus.keySet());
        droppedPartnerIds.addAll(cachedSnapshot.getPartnerConsents().keySet());
        droppedPartnerIds.removeAll(newPartnerConsents.keySet());
        droppedPartnerIds.forEach(partnerId ->
                updatePartnerConsent(partnerId, ConsentStatus.UNKNOWN, notify, cachedSnapshot));
    }

    private void updatePartnerConsent(String partnerId,
                                      ConsentStatus newStatus,
                                      NotificationType notify,
                                      ConsentSnapshot cachedSnapshot) {

        final ConsentStatus previousStatus = partnerConsentStatus.getOrDefault(partnerId, ConsentStatus.UNKNOWN);
        final ConsentValue newValue = newStatus.toConsentValue();
        logger.debug("Setting consent for partner {} to {}", partnerId, newValue);

        if (newValue != null) {
            partnerConsentStatus.put(partnerId, newStatus);
            consents.put(partnerId, newValue.value());
        } else {
            partnerConsentStatus.remove(partnerId);
            consents.remove(partnerId);
        }

        if (notify.shouldNotify(previousStatus, cachedSnapshot.partnerConsent(partnerId), newStatus)) {
            notifier.consentChanged(partnerId);
        }
    }

    private void updateCcpaOptIn(Boolean optedOut, NotificationType notify, ConsentSnapshot cachedSnapshot) {
        final ConsentValue newCcpaOptIn = optedOut != null ? ConsentValue.of(!optedOut) : null;
        logger.debug("Setting CCPA opt in to {}", newCcpaOptIn);
        updateConsent(
                ConsentStandard.CCPA_OPT_IN.value(),
                newCcpaOptIn != null ? newCcpaOptIn.value() : null,
                notify,
                cachedSnapshot);
    }

    private void updateUsp(String uspString, NotificationType notify, ConsentSnapshot cachedSnapshot) {
        logger.debug("Setting USP to {}", uspString);
        updateConsent(ConsentStandard.USP.value(), uspString, notify, cachedSnapshot);
    }

    private void updateTcf(String tcString, NotificationType notify, ConsentSnapshot cachedSnapshot) {
        logger.debug("Setting TCF to {}", tcString);
        updateConsent(ConsentStandard.TCF.value(), tcString, notify, cachedSnapshot);
    }

    private void updateConsent(String key, String value, NotificationType notify, ConsentSnapshot cachedSnapshot) {
        final String newValue = StringUtils.defaultIfEmpty(value, null);
        final String previousValue = newValue != null ? consents.put(key, newValue) : consents.remove(key);

        if (notify.shouldNotify(previousValue, cachedSnapshot.consent(key), newValue)) {
            notifier.consentChanged(key);
        }
    }
}
