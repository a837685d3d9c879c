package com.example.i18n.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Translation settings, bound from {@code i18n.*}.
 *
 * <pre>
 * i18n:
 *   languages: [en, es]
 *   default-language: en
 *   locales-dir: ./locales
 *   fallback:
 *     enabled: true
 *     show-indicator: true
 *     indicator-format: "{text} [{locale}]"
 *   client-load:
 *     enabled: true
 *     always: [common]
 *     routes:
 *       - pattern: /indicators/*
 *         namespaces: [features.indicators]
 *     fallback: always-only
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "i18n")
public class I18nProperties {

    /** Supported language codes. */
    @NotEmpty
    private List<String> languages = new ArrayList<>();

    /** Language used when no preference is detected. */
    @NotBlank
    private String defaultLanguage;

    /** Directory holding one folder per language. */
    private String localesDir = "./locales";

    /** Show {@code [key]} for unresolved keys in production instead of an empty string. */
    private boolean showKeysInProd = false;

    /** Forces production behavior on or off; unset means "prod profile active". */
    private Boolean production;

    @Valid
    private Fallback fallback = new Fallback();

    @Valid
    private ClientLoad clientLoad = new ClientLoad();

    public List<String> getLanguages() {
        return languages;
    }

    public void setLanguages(List<String> languages) {
        this.languages = languages;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public String getLocalesDir() {
        return localesDir;
    }

    public void setLocalesDir(String localesDir) {
        this.localesDir = localesDir;
    }

    public boolean isShowKeysInProd() {
        return showKeysInProd;
    }

    public void setShowKeysInProd(boolean showKeysInProd) {
        this.showKeysInProd = showKeysInProd;
    }

    public Boolean getProduction() {
        return production;
    }

    public void setProduction(Boolean production) {
        this.production = production;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    public ClientLoad getClientLoad() {
        return clientLoad;
    }

    public void setClientLoad(ClientLoad clientLoad) {
        this.clientLoad = clientLoad;
    }

    public static class Fallback {

        /** Fill keys missing in the requested language from the default language. */
        private boolean enabled = false;

        /** Mark fallback text with the indicator (production behavior only). */
        private boolean showIndicator = false;

        /** Indicator template; {@code {text}} and {@code {locale}} are substituted. */
        private String indicatorFormat = "{text} [{locale}]";

        /** Apply production fallback behavior during development too. */
        private boolean applyOnDev = false;

        /** Minimum word count of a fallback text before the indicator shows; 0 disables the check. */
        private int minIndicatorWords = 0;

        /** Minimum non-whitespace character count before the indicator shows; 0 disables the check. */
        private int minIndicatorLetters = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isShowIndicator() {
            return showIndicator;
        }

        public void setShowIndicator(boolean showIndicator) {
            this.showIndicator = showIndicator;
        }

        public String getIndicatorFormat() {
            return indicatorFormat;
        }

        public void setIndicatorFormat(String indicatorFormat) {
            this.indicatorFormat = indicatorFormat;
        }

        public boolean isApplyOnDev() {
            return applyOnDev;
        }

        public void setApplyOnDev(boolean applyOnDev) {
            this.applyOnDev = applyOnDev;
        }

        public int getMinIndicatorWords() {
            return minIndicatorWords;
        }

        public void setMinIndicatorWords(int minIndicatorWords) {
            this.minIndicatorWords = minIndicatorWords;
        }

        public int getMinIndicatorLetters() {
            return minIndicatorLetters;
        }

        public void setMinIndicatorLetters(int minIndicatorLetters) {
            this.minIndicatorLetters = minIndicatorLetters;
        }
    }

    public static class ClientLoad {

        /** Inject a client payload into HTML responses. */
        private boolean enabled = false;

        /** Namespaces shipped on every page. */
        private List<String> always = new ArrayList<>();

        /** Route patterns, evaluated in order. */
        @Valid
        private List<Route> routes = new ArrayList<>();

        /** all, none or always-only. */
        private String fallback = "always-only";

        private boolean ignoreTrailingSlash = false;

        private boolean warnOnOverlap = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getAlways() {
            return always;
        }

        public void setAlways(List<String> always) {
            this.always = always;
        }

        public List<Route> getRoutes() {
            return routes;
        }

        public void setRoutes(List<Route> routes) {
            this.routes = routes;
        }

        public String getFallback() {
            return fallback;
        }

        public void setFallback(String fallback) {
            this.fallback = fallback;
        }

        public boolean isIgnoreTrailingSlash() {
            return ignoreTrailingSlash;
        }

        public void setIgnoreTrailingSlash(boolean ignoreTrailingSlash) {
            this.ignoreTrailingSlash = ignoreTrailingSlash;
        }

        public boolean isWarnOnOverlap() {
            return warnOnOverlap;
        }

        public void setWarnOnOverlap(boolean warnOnOverlap) {
            this.warnOnOverlap = warnOnOverlap;
        }
    }

    public static class Route {

        @NotBlank
        private String pattern;

        private List<String> namespaces = new ArrayList<>();

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public List<String> getNamespaces() {
            return namespaces;
        }

        public void setNamespaces(List<String> namespaces) {
            this.namespaces = namespaces;
        }
    }
}
