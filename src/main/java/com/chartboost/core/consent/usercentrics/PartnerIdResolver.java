package com.chartboost.core.consent.usercentrics;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates Usercentrics template ids into Chartboost partner ids.
 * <p>
 * Instances are immutable. Template ids without a mapping resolve to themselves.
 */
public class PartnerIdResolver {

    public static final Map<String, String> DEFAULT_TEMPLATE_ID_TO_PARTNER_ID;

    static {
        final Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("J64M6DKwx", "adcolony");
        defaults.put("r7rvuoyDz", "admob");
        defaults.put("IUyljv4X5", "amazon_aps");
        defaults.put("fHczTMzX8", "applovin");
        defaults.put("IEbRp3saT", "chartboost");
        defaults.put("H17alcVo_iZ7", "fyber");
        defaults.put("S1_9Vsuj-Q", "google_googlebidding");
        defaults.put("ROCBK21nx", "hyprmx");
        defaults.put("ax0HAgRdZ", "inmobi");
        defaults.put("9dchbL797", "ironsource");
        defaults.put("E6AgqirYV", "meta");
        defaults.put("VPX2-_pDq", "mintegral");
        defaults.put("HWSNU_Ll1", "pangle");
        defaults.put("B1DLe54jui-X", "tapjoy");
        defaults.put("hpb62D82I", "unity");
        defaults.put("5bv4OvSwoXKh-G", "verve");
        defaults.put("jk3jF2tpw", "vungle");
        defaults.put("EMD3qUMa8", "vungle");
        DEFAULT_TEMPLATE_ID_TO_PARTNER_ID = Collections.unmodifiableMap(defaults);
    }

    private static final PartnerIdResolver DEFAULT = new PartnerIdResolver(DEFAULT_TEMPLATE_ID_TO_PARTNER_ID);

    private final Map<String, String> templateIdToPartnerId;

    private PartnerIdResolver(Map<String, String> templateIdToPartnerId) {
        this.templateIdToPartnerId = templateIdToPartnerId;
    }

    public static PartnerIdResolver defaults() {
        return DEFAULT;
    }

    /**
     * Returns a resolver with the given overrides applied on top of the default mapping.
     */
    public static PartnerIdResolver withOverrides(Map<String, String> overrides) {
        return DEFAULT.extend(overrides);
    }

    /**
     * Returns a resolver with the given overrides applied on top of this one. Blank entries are skipped.
     */
    public PartnerIdResolver extend(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }

        final Map<String, String> merged = new HashMap<>(templateIdToPartnerId);
        overrides.forEach((templateId, partnerId) -> {
            if (StringUtils.isNoneBlank(templateId, partnerId)) {
                merged.put(templateId, partnerId);
            }
        });
        return new PartnerIdResolver(Collections.unmodifiableMap(merged));
    }

    public String resolve(String templateId) {
        return templateIdToPartnerId.getOrDefault(templateId, templateId);
    }

    public Map<String, String> mappings() {
        return templateIdToPartnerId;
    }
}
