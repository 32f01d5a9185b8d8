package com.chartboost.core.consent.usercentrics;

import com.chartboost.core.consent.ConsentAdapterListener;
import com.chartboost.core.consent.ConsentStatus;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsReadyStatus;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsServiceConsent;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mock.Strictness.LENIENT;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
public class ConsentReconcilerTest {

    private static final String ADMOB_TEMPLATE_ID = "r7rvuoyDz";
    private static final String TCF = "tcf";
    private static final String USP = "usp";
    private static final String CCPA_OPT_IN = "ccpa_opt_in";

    @Mock(strictness = LENIENT)
    private Context mainContext;

    @Mock
    private ConsentAdapterListener listener;

    private FakeUsercentricsSdk usercentricsSdk;

    private ConsentReconciler target;

    @BeforeEach
    public void setUp() {
        willAnswer(withNullAndInvokeHandler()).given(mainContext).runOnContext(any());

        usercentricsSdk = new FakeUsercentricsSdk();
        final ConsentNotifier notifier = new ConsentNotifier();
        notifier.setListener(listener);

        target = new ConsentReconciler(usercentricsSdk, mainContext, notifier);
    }

    @Test
    public void refreshShouldPopulateAllRepresentations() {
        // given
        usercentricsSdk
                .shouldCollectConsent(false)
                .serviceConsents(UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true))
                .optedOut(false)
                .uspString("1YNN")
                .tcString("CPtcf");

        // when
        final Future<Void> result = refresh(NotificationType.NEVER);

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(target.consents()).containsOnly(
                entry("admob", "GRANTED"),
                entry(CCPA_OPT_IN, "GRANTED"),
                entry(USP, "1YNN"),
                entry(TCF, "CPtcf"));
        assertThat(target.shouldCollectConsent()).isFalse();
        verifyNoInteractions(listener);
    }

    @Test
    public void refreshShouldLeaveEmptyAndUnknownValuesAbsent() {
        // given
        usercentricsSdk.optedOut(null).uspString("").tcString("");

        // when
        refresh(NotificationType.NEVER);

        // then
        assertThat(target.consents()).isEmpty();
    }

    @Test
    public void refreshShouldMapOptedOutToDenied() {
        // given
        usercentricsSdk.optedOut(true);

        // when
        refresh(NotificationType.NEVER);

        // then
        assertThat(target.consents()).containsOnly(entry(CCPA_OPT_IN, "DENIED"));
    }

    @Test
    public void refreshShouldUseTemplateIdWhenPartnerIsUnmapped() {
        // given
        usercentricsSdk.serviceConsents(UsercentricsServiceConsent.of("zzz", "Unknown", false));

        // when
        refresh(NotificationType.NEVER);

        // then
        assertThat(target.consents()).containsOnly(entry("zzz", "DENIED"));
    }

    @Test
    public void refreshShouldSkipPartnerWhoseIdClashesWithConsentStandard() {
        // given
        usercentricsSdk
                .serviceConsents(
                        UsercentricsServiceConsent.of(USP, "Unmapped", true),
                        UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true))
                .uspString("1YNN");

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        assertThat(target.consents()).containsOnly(entry("admob", "GRANTED"), entry(USP, "1YNN"));
        verify(listener).onConsentChange("admob");
        verify(listener, times(1)).onConsentChange(USP);
        verifyNoMoreInteractions(listener);
    }

    @Test
    public void refreshShouldNotifyOncePerChangedKeyWithCurrentValuePolicy() {
        // given
        usercentricsSdk.optedOut(false).uspString("1YNN").tcString("first");
        refresh(NotificationType.NEVER);
        usercentricsSdk.optedOut(true).uspString("1YYN").tcString("first");

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        verify(listener).onConsentChange(CCPA_OPT_IN);
        verify(listener).onConsentChange(USP);
        verify(listener, times(2)).onConsentChange(anyString());
    }

    @Test
    public void refreshShouldNotNotifyWhenNothingChanged() {
        // given
        usercentricsSdk
                .serviceConsents(UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true))
                .optedOut(false)
                .uspString("1YNN")
                .tcString("CPtcf");
        refresh(NotificationType.NEVER);

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);
        refresh(NotificationType.DIFFERENT_FROM_CACHED_VALUE);

        // then
        verifyNoInteractions(listener);
    }

    @Test
    public void refreshShouldRemoveAndNotifyClearedValue() {
        // given
        usercentricsSdk.uspString("1YNN");
        refresh(NotificationType.NEVER);
        usercentricsSdk.uspString("");

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        assertThat(target.consents()).doesNotContainKey(USP);
        verify(listener).onConsentChange(USP);
    }

    @Test
    public void refreshShouldNotNotifyAgainstCachedBaselineWhenValueReturns() {
        // given
        usercentricsSdk.tcString("x");
        refresh(NotificationType.NEVER);
        final ConsentSnapshot baseline = target.snapshot();
        target.clear();

        // when
        target.refresh(readyStatus(), NotificationType.DIFFERENT_FROM_CACHED_VALUE, baseline);

        // then
        assertThat(target.consents()).containsOnly(entry(TCF, "x"));
        verifyNoInteractions(listener);
    }

    @Test
    public void refreshShouldNotifyAgainstCurrentValueAfterClear() {
        // given
        usercentricsSdk.tcString("x");
        refresh(NotificationType.NEVER);
        target.clear();

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        verify(listener).onConsentChange(TCF);
    }

    @Test
    public void refreshShouldNotifyPartnerChangesIndividually() {
        // given
        usercentricsSdk.serviceConsents(
                UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true),
                UsercentricsServiceConsent.of("fHczTMzX8", "AppLovin", true));
        refresh(NotificationType.NEVER);
        usercentricsSdk.serviceConsents(
                UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", false),
                UsercentricsServiceConsent.of("fHczTMzX8", "AppLovin", true));

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        assertThat(target.consents()).containsOnly(entry("admob", "DENIED"), entry("applovin", "GRANTED"));
        verify(listener).onConsentChange("admob");
        verifyNoMoreInteractions(listener);
    }

    @Test
    public void refreshShouldRemoveAndNotifyPartnerNoLongerReported() {
        // given
        usercentricsSdk.serviceConsents(UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true));
        refresh(NotificationType.NEVER);
        usercentricsSdk.serviceConsents();

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        assertThat(target.consents()).isEmpty();
        verify(listener).onConsentChange("admob");
    }

    @Test
    public void refreshShouldNotifyPartnerMissingAfterResetAgainstCachedBaseline() {
        // given
        usercentricsSdk.serviceConsents(UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true));
        refresh(NotificationType.NEVER);
        final ConsentSnapshot baseline = target.snapshot();
        target.clear();
        usercentricsSdk.serviceConsents();

        // when
        target.refresh(readyStatus(), NotificationType.DIFFERENT_FROM_CACHED_VALUE, baseline);

        // then
        assertThat(target.consents()).isEmpty();
        verify(listener).onConsentChange("admob");
    }

    @Test
    public void refreshShouldApplyPartnerIdOverrides() {
        // given
        target.setPartnerIdResolver(PartnerIdResolver.withOverrides(Map.of("zzz", "custom")));
        usercentricsSdk.serviceConsents(UsercentricsServiceConsent.of("zzz", "Custom", true));

        // when
        refresh(NotificationType.NEVER);

        // then
        assertThat(target.consents()).containsOnly(entry("custom", "GRANTED"));
    }

    @Test
    public void refreshShouldTrackConsentStatusOfCoreDps() {
        // given
        usercentricsSdk.serviceConsents(UsercentricsServiceConsent.of("coreTemplate", "ChartboostCore", true));
        refresh(NotificationType.NEVER);
        usercentricsSdk.serviceConsents(UsercentricsServiceConsent.of("coreTemplate", "ChartboostCore", false));

        // when
        refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        assertThat(target.consentStatus()).isEqualTo(ConsentStatus.DENIED);
        verify(listener).onConsentStatusChange(ConsentStatus.DENIED);
    }

    @Test
    public void refreshShouldUseConfiguredCoreDpsName() {
        // given
        target.setCoreDpsName("MyCore");
        usercentricsSdk.serviceConsents(
                UsercentricsServiceConsent.of("a", "ChartboostCore", false),
                UsercentricsServiceConsent.of("b", "MyCore", true));

        // when
        refresh(NotificationType.NEVER);

        // then
        assertThat(target.consentStatus()).isEqualTo(ConsentStatus.GRANTED);
    }

    @Test
    public void refreshShouldReportUnknownStatusWhenCoreDpsIsMissing() {
        // when
        refresh(NotificationType.NEVER);

        // then
        assertThat(target.consentStatus()).isEqualTo(ConsentStatus.UNKNOWN);
    }

    @Test
    public void refreshShouldCompleteOnlyAfterTcfDataArrives() {
        // given
        usercentricsSdk.tcString("late").deferTcfData(true);

        // when
        final Future<Void> result = refresh(NotificationType.NEVER);

        // then
        assertThat(result.isComplete()).isFalse();
        assertThat(target.consents()).doesNotContainKey(TCF);

        usercentricsSdk.completeTcfData();
        assertThat(result.succeeded()).isTrue();
        assertThat(target.consents()).containsEntry(TCF, "late");
    }

    @Test
    public void refreshShouldContinueWhenListenerThrows() {
        // given
        usercentricsSdk.uspString("1YNN").tcString("tcf");
        willThrow(new IllegalStateException("boom")).given(listener).onConsentChange(anyString());

        // when
        final Future<Void> result = refresh(NotificationType.DIFFERENT_FROM_CURRENT_VALUE);

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(target.consents()).containsOnly(entry(USP, "1YNN"), entry(TCF, "tcf"));
        verify(listener).onConsentChange(USP);
        verify(listener).onConsentChange(TCF);
    }

    @Test
    public void clearAndNotifyShouldReportEveryKeyAndUnknownStatus() {
        // given
        usercentricsSdk
                .serviceConsents(UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true))
                .optedOut(false);
        refresh(NotificationType.NEVER);

        // when
        target.clearAndNotify();

        // then
        assertThat(target.consents()).isEmpty();
        assertThat(target.consentStatus()).isEqualTo(ConsentStatus.UNKNOWN);
        verify(listener).onConsentChange("admob");
        verify(listener).onConsentChange(CCPA_OPT_IN);
        verify(listener).onConsentStatusChange(ConsentStatus.UNKNOWN);
        verifyNoMoreInteractions(listener);
    }

    @Test
    public void clearAndNotifyShouldReportKeysOfBaselineClearedBeforehand() {
        // given
        usercentricsSdk
                .serviceConsents(UsercentricsServiceConsent.of(ADMOB_TEMPLATE_ID, "Google AdMob", true))
                .optedOut(false);
        refresh(NotificationType.NEVER);
        final ConsentSnapshot baseline = target.snapshot();
        target.clear();

        // when
        target.clearAndNotify(baseline);

        // then
        assertThat(target.consents()).isEmpty();
        verify(listener).onConsentChange("admob");
        verify(listener).onConsentChange(CCPA_OPT_IN);
        verify(listener).onConsentStatusChange(ConsentStatus.UNKNOWN);
        verifyNoMoreInteractions(listener);
    }

    @Test
    public void clearAndNotifyShouldReportStatusAfterRemovingKeys() {
        // given
        usercentricsSdk.optedOut(true);
        refresh(NotificationType.NEVER);

        // when
        target.clearAndNotify();

        // then
        final InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onConsentChange(CCPA_OPT_IN);
        inOrder.verify(listener).onConsentStatusChange(ConsentStatus.UNKNOWN);
    }

    @Test
    public void consentsShouldBeReadOnly() {
        // when and then
        assertThat(target.consents()).isUnmodifiable();
    }

    private Future<Void> refresh(NotificationType notify) {
        return target.refresh(readyStatus(), notify, target.snapshot());
    }

    private UsercentricsReadyStatus readyStatus() {
        final UsercentricsReadyStatus[] captured = new UsercentricsReadyStatus[1];
        usercentricsSdk.isReady(status -> captured[0] = status, error -> {
        });
        return captured[0] != null ? captured[0] : UsercentricsReadyStatus.of(true, List.of());
    }

    @SuppressWarnings("unchecked")
    private static Answer<Object> withNullAndInvokeHandler() {
        return invocation -> {
            ((Handler<Void>) invocation.getArgument(0)).handle(null);
            return null;
        };
    }
}
