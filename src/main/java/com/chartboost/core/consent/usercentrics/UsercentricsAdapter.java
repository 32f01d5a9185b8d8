package com.chartboost.core.consent.usercentrics;

import com.chartboost.core.consent.ConsentAdapter;
import com.chartboost.core.consent.ConsentAdapterListener;
import com.chartboost.core.consent.ConsentDialogType;
import com.chartboost.core.consent.ConsentStatus;
import com.chartboost.core.consent.ConsentStatusSource;
import com.chartboost.core.consent.usercentrics.config.UsercentricsAdapterConfiguration;
import com.chartboost.core.consent.usercentrics.config.UsercentricsPropertiesParser;
import com.chartboost.core.consent.usercentrics.sdk.BannerSettings;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsBanner;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsBannerFactory;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsConsentType;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsDisposableEvent;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsOptions;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsSdk;
import com.chartboost.core.error.ConsentError;
import com.chartboost.core.error.ConsentException;
import com.chartboost.core.initialization.InitializableModule;
import com.chartboost.core.initialization.ModuleInitializationConfiguration;
import com.chartboost.core.json.JacksonMapper;
import com.chartboost.core.json.ObjectMapperProvider;
import com.chartboost.core.log.Logger;
import com.chartboost.core.log.LoggerFactory;
import com.chartboost.core.version.ModuleVersion;
import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link ConsentAdapter} backed by the Usercentrics CMP SDK.
 * <p>
 * Public operations go through {@link UsercentricsReadinessGate} and finish with a
 * {@link ConsentReconciler#refresh}. Concurrent operations are not serialized: callers racing, for example,
 * {@link #grantConsent} with {@link #resetConsent} get last-writer-wins consent state.
 */
public class UsercentricsAdapter implements ConsentAdapter, InitializableModule {

    private static final Logger logger = LoggerFactory.getLogger(UsercentricsAdapter.class);

    public static final String MODULE_ID = "usercentrics";

    private static final String VERSION_FILE = "usercentrics-adapter-version.json";

    private final UsercentricsSdk usercentricsSdk;
    private final UsercentricsBannerFactory bannerFactory;
    private final Context mainContext;
    private final BannerSettings bannerSettings;
    private final PartnerIdResolver basePartnerIdResolver;
    private final UsercentricsPropertiesParser propertiesParser;
    private final String moduleVersion;

    private final ConsentNotifier notifier;
    private final ConsentReconciler reconciler;
    private final UsercentricsReadinessGate readinessGate;

    private volatile UsercentricsOptions options;
    private UsercentricsDisposableEvent consentUpdatedSubscription;

    public UsercentricsAdapter(UsercentricsSdk usercentricsSdk,
                               UsercentricsBannerFactory bannerFactory,
                               Context mainContext,
                               UsercentricsAdapterSettings settings) {

        this.usercentricsSdk = Objects.requireNonNull(usercentricsSdk);
        this.bannerFactory = Objects.requireNonNull(bannerFactory);
        this.mainContext = Objects.requireNonNull(mainContext);
        Objects.requireNonNull(settings);

        final JacksonMapper jacksonMapper = new JacksonMapper(ObjectMapperProvider.mapper());
        this.propertiesParser = new UsercentricsPropertiesParser(jacksonMapper);
        this.moduleVersion = ModuleVersion.create(VERSION_FILE, jacksonMapper).getVersion();

        this.options = settings.getOptions();
        this.bannerSettings = settings.getBannerSettings();
        this.basePartnerIdResolver = PartnerIdResolver.withOverrides(settings.getPartnerIdOverrides());

        this.notifier = new ConsentNotifier();
        this.reconciler = new ConsentReconciler(usercentricsSdk, mainContext, notifier);
        reconciler.setCoreDpsName(settings.getCoreDpsName());
        reconciler.setPartnerIdResolver(basePartnerIdResolver);

        this.readinessGate = new UsercentricsReadinessGate(
                usercentricsSdk,
                mainContext,
                () -> options,
                this::initializeUsercentrics,
                reconciler::clearAndNotify);
    }

    public UsercentricsAdapter(UsercentricsSdk usercentricsSdk,
                               UsercentricsBannerFactory bannerFactory,
                               Context mainContext) {

        this(usercentricsSdk, bannerFactory, mainContext, UsercentricsAdapterSettings.DEFAULT);
    }

    @Override
    public String moduleId() {
        return MODULE_ID;
    }

    @Override
    public String moduleVersion() {
        return moduleVersion;
    }

    @Override
    public void updateProperties(JsonNode configuration) {
        final UsercentricsAdapterConfiguration adapterConfiguration;
        try {
            adapterConfiguration = propertiesParser.parse(configuration);
        } catch (DecodeException e) {
            logger.warn("Ignoring invalid Usercentrics adapter configuration: {}", e.getMessage());
            return;
        }

        options = adapterConfiguration.getOptions();
        reconciler.setCoreDpsName(adapterConfiguration.getCoreDpsName());
        reconciler.setPartnerIdResolver(basePartnerIdResolver.extend(adapterConfiguration.getPartnerIdOverrides()));
    }

    @Override
    public Future<Void> initialize(ModuleInitializationConfiguration configuration) {
        final UsercentricsOptions currentOptions = options;
        if (currentOptions == null) {
            return Future.failedFuture(new ConsentException(ConsentError.INITIALIZATION_ERROR));
        }

        return onMainContext(() -> {
            initializeUsercentrics(currentOptions);
            return fetchConsentInfo(NotificationType.NEVER, ConsentSnapshot.EMPTY);
        });
    }

    @Override
    public boolean shouldCollectConsent() {
        return reconciler.shouldCollectConsent();
    }

    @Override
    public Map<String, String> consents() {
        return reconciler.consents();
    }

    @Override
    public ConsentStatus consentStatus() {
        return reconciler.consentStatus();
    }

    @Override
    public ConsentAdapterListener getListener() {
        return notifier.getListener();
    }

    @Override
    public void setListener(ConsentAdapterListener listener) {
        notifier.setListener(listener);
    }

    public UsercentricsOptions getOptions() {
        return options;
    }

    public void setOptions(UsercentricsOptions options) {
        this.options = options;
    }

    public String getCoreDpsName() {
        return reconciler.getCoreDpsName();
    }

    @Override
    public Future<Void> grantConsent(ConsentStatusSource statusSource) {
        return readinessGate.executeWhenReady(readyStatus -> {
            usercentricsSdk.acceptAll(toUsercentricsConsentType(statusSource));
            return fetchConsentInfo(NotificationType.DIFFERENT_FROM_CURRENT_VALUE, reconciler.snapshot());
        });
    }

    @Override
    public Future<Void> denyConsent(ConsentStatusSource statusSource) {
        return readinessGate.executeWhenReady(readyStatus -> {
            usercentricsSdk.denyAll(toUsercentricsConsentType(statusSource));
            return fetchConsentInfo(NotificationType.DIFFERENT_FROM_CURRENT_VALUE, reconciler.snapshot());
        });
    }

    @Override
    public Future<Void> resetConsent() {
        return onMainContext(() -> {
            final UsercentricsOptions currentOptions = options != null
                    ? options
                    : UsercentricsOptions.builder().build();
            final ConsentSnapshot cachedSnapshot = reconciler.snapshot();

            reconciler.clear();
            usercentricsSdk.reset();
            initializeUsercentrics(currentOptions);

            return fetchConsentInfo(NotificationType.DIFFERENT_FROM_CACHED_VALUE, cachedSnapshot);
        });
    }

    @Override
    public Future<Void> showConsentDialog(ConsentDialogType dialogType) {
        return readinessGate.executeWhenReady(readyStatus -> showDialog(dialogType));
    }

    private Future<Void> showDialog(ConsentDialogType dialogType) {
        final UsercentricsBanner banner = bannerFactory.create(bannerSettings);

        if (ConsentDialogType.CONCISE.equals(dialogType)) {
            banner.showFirstLayer(userResponse -> logger.debug("1st layer response: {}", userResponse));
            return Future.succeededFuture();
        }

        if (ConsentDialogType.DETAILED.equals(dialogType)) {
            banner.showSecondLayer(userResponse -> logger.debug("2nd layer response: {}", userResponse));
            return Future.succeededFuture();
        }

        logger.debug("Unexpected consent dialog type: {}", dialogType);
        return Future.failedFuture(new ConsentException(ConsentError.DIALOG_SHOW_ERROR));
    }

    private Future<Void> fetchConsentInfo(NotificationType notify, ConsentSnapshot cachedSnapshot) {
        return readinessGate.executeWhenReady(
                readyStatus -> reconciler.refresh(readyStatus, notify, cachedSnapshot),
                () -> reconciler.clearAndNotify(cachedSnapshot));
    }

    private void initializeUsercentrics(UsercentricsOptions usercentricsOptions) {
        usercentricsSdk.initialize(usercentricsOptions);

        usercentricsSdk.isReady(
                ignored -> mainContext.runOnContext(v -> attachConsentUpdatedListener()),
                error -> logger.debug("Unable to attach onConsentUpdated listener: {}",
                        error != null ? error.getMessage() : null));
    }

    private void attachConsentUpdatedListener() {
        if (consentUpdatedSubscription != null) {
            consentUpdatedSubscription.dispose();
        }

        consentUpdatedSubscription = usercentricsSdk.onConsentUpdated(event -> mainContext.runOnContext(v ->
                fetchConsentInfo(NotificationType.DIFFERENT_FROM_CURRENT_VALUE, reconciler.snapshot())
                        .onFailure(throwable -> logger.debug(
                                "Unable to refresh consents after external update: {}", throwable.getMessage()))));
    }

    private Future<Void> onMainContext(Supplier<Future<Void>> operation) {
        final Promise<Void> promise = Promise.promise();
        mainContext.runOnContext(ignored -> {
            try {
                operation.get().onComplete(promise);
            } catch (Exception e) {
                logger.warn("{} when executing Usercentrics operation", e, e);
                promise.tryFail(new ConsentException(ConsentError.UNKNOWN, e));
            }
        });
        return promise.future();
    }

    private static UsercentricsConsentType toUsercentricsConsentType(ConsentStatusSource statusSource) {
        return statusSource == ConsentStatusSource.USER
                ? UsercentricsConsentType.EXPLICIT
                : UsercentricsConsentType.IMPLICIT;
    }
}
