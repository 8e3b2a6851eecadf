package com.uisafe.core;

import com.uisafe.model.ScrollBlock;

/**
 * Configuration for UiSafe interactors.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   UISAFE_AUTOSCROLL        - Scroll non-interactable elements into view and retry once (default: true)
 *   UISAFE_SCROLL_BLOCK      - Vertical alignment after scrolling: START|CENTER|END|NEAREST (default: CENTER)
 *   UISAFE_DISMISS_ALERTS    - Close unexpected alerts blocking the driver and retry once (default: true)
 *   UISAFE_ACCEPT_ALERTS     - Accept such alerts instead of dismissing them (default: false)
 *   UISAFE_LOG_INTERACTIONS  - Log every proxied interaction to SLF4J (default: false)
 *
 * Invalid values fall back to the defaults.
 */
public class UiSafeConfig {

    public static final ScrollBlock DEFAULT_SCROLL_BLOCK = ScrollBlock.CENTER;

    private final boolean     autoscrollEnabled;
    private final ScrollBlock scrollBlock;
    private final boolean     dismissAlertsEnabled;
    private final boolean     acceptAlerts;      // only meaningful when dismissAlertsEnabled
    private final boolean     logInteractions;

    private UiSafeConfig(Builder b) {
        this.autoscrollEnabled    = b.autoscrollEnabled;
        this.scrollBlock          = b.scrollBlock;
        this.dismissAlertsEnabled = b.dismissAlertsEnabled;
        this.acceptAlerts         = b.acceptAlerts;
        this.logInteractions      = b.logInteractions;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static UiSafeConfig defaults() {
        return builder().build();
    }

    public static UiSafeConfig fromEnvironment() {
        return builder()
            .autoscrollEnabled(boolEnvOrDefault("UISAFE_AUTOSCROLL", true))
            .scrollBlock(scrollBlockEnvOrDefault("UISAFE_SCROLL_BLOCK", DEFAULT_SCROLL_BLOCK))
            .dismissAlertsEnabled(boolEnvOrDefault("UISAFE_DISMISS_ALERTS", true))
            .acceptAlerts(boolEnvOrDefault("UISAFE_ACCEPT_ALERTS", false))
            .logInteractions(boolEnvOrDefault("UISAFE_LOG_INTERACTIONS", false))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public boolean     isAutoscrollEnabled()    { return autoscrollEnabled; }
    public ScrollBlock getScrollBlock()         { return scrollBlock; }
    public boolean     isDismissAlertsEnabled() { return dismissAlertsEnabled; }
    public boolean     isAcceptAlerts()         { return acceptAlerts; }
    public boolean     isLogInteractions()      { return logInteractions; }

    @Override
    public String toString() {
        return String.format(
            "UiSafeConfig{autoscroll=%s, scrollBlock=%s, dismissAlerts=%s, acceptAlerts=%s, logInteractions=%s}",
            autoscrollEnabled, scrollBlock, dismissAlertsEnabled, acceptAlerts, logInteractions);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private boolean     autoscrollEnabled    = true;
        private ScrollBlock scrollBlock          = DEFAULT_SCROLL_BLOCK;
        private boolean     dismissAlertsEnabled = true;
        private boolean     acceptAlerts         = false;
        private boolean     logInteractions      = false;

        public Builder autoscrollEnabled(boolean b)       { this.autoscrollEnabled = b; return this; }
        public Builder scrollBlock(ScrollBlock block)     { this.scrollBlock = block; return this; }
        public Builder dismissAlertsEnabled(boolean b)    { this.dismissAlertsEnabled = b; return this; }
        public Builder acceptAlerts(boolean b)            { this.acceptAlerts = b; return this; }
        public Builder logInteractions(boolean b)         { this.logInteractions = b; return this; }

        public UiSafeConfig build() {
            if (scrollBlock == null) {
                scrollBlock = DEFAULT_SCROLL_BLOCK;
            }
            return new UiSafeConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    static boolean parseBool(String val, boolean defaultValue) {
        if (val == null || val.isBlank()) return defaultValue;
        String v = val.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        return defaultValue;
    }

    static ScrollBlock parseScrollBlock(String val, ScrollBlock defaultValue) {
        if (val == null || val.isBlank()) return defaultValue;
        try { return ScrollBlock.valueOf(val.trim().toUpperCase()); }
        catch (IllegalArgumentException e) { return defaultValue; }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        return parseBool(System.getenv(key), defaultValue);
    }

    private static ScrollBlock scrollBlockEnvOrDefault(String key, ScrollBlock defaultValue) {
        return parseScrollBlock(System.getenv(key), defaultValue);
    }
}
