package com.shiprule.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the shipping engine.
 */
@ConfigurationProperties(prefix = "shipping")
public class ShippingProperties {

    /**
     * Whether the shipping engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the shipping profile file.
     * Supports classpath: prefix for classpath resources.
     */
    private String profilesPath = "classpath:shipping-profiles.yaml";

    private final Sweep sweep = new Sweep();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProfilesPath() {
        return profilesPath;
    }

    public void setProfilesPath(String profilesPath) {
        this.profilesPath = profilesPath;
    }

    public Sweep getSweep() {
        return sweep;
    }

    /**
     * Background calculation of orders without a stored calculation.
     */
    public static class Sweep {

        private boolean enabled = false;

        private long intervalSeconds = 300;

        private long initialDelaySeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public long getInitialDelaySeconds() {
            return initialDelaySeconds;
        }

        public void setInitialDelaySeconds(long initialDelaySeconds) {
            this.initialDelaySeconds = initialDelaySeconds;
        }
    }
}
