package com.feeledger.config;

import com.feeledger.policy.FeePolicy;
import com.feeledger.policy.ProrationMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code feeledger.*}.
 */
@ConfigurationProperties(prefix = "feeledger")
public class FeeLedgerProperties {

    /** Precision for policy documents that do not set one. */
    private int defaultPrecision = FeePolicy.DEFAULT_PRECISION;

    /** Forces strict mode on every settle and adjust; otherwise the policy decides. */
    private boolean strict = false;

    private ProrationMethod defaultProration = ProrationMethod.BY_NET;

    /** Resource locations of JSON policy documents, e.g. {@code classpath:policies/*.json}. */
    private List<String> policies = new ArrayList<>();

    private PolicyCache policyCache = new PolicyCache();

    public int getDefaultPrecision() {
        return defaultPrecision;
    }

    public void setDefaultPrecision(int defaultPrecision) {
        this.defaultPrecision = defaultPrecision;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public ProrationMethod getDefaultProration() {
        return defaultProration;
    }

    public void setDefaultProration(ProrationMethod defaultProration) {
        this.defaultProration = defaultProration;
    }

    public List<String> getPolicies() {
        return policies;
    }

    public void setPolicies(List<String> policies) {
        this.policies = policies;
    }

    public PolicyCache getPolicyCache() {
        return policyCache;
    }

    public void setPolicyCache(PolicyCache policyCache) {
        this.policyCache = policyCache;
    }

    public static class PolicyCache {

        private boolean enabled = true;

        private int maxEntries = com.feeledger.policy.PolicyCache.DEFAULT_MAX_ENTRIES;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }
}
