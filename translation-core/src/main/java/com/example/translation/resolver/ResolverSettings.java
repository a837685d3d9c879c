package com.example.translation.resolver;

import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.BooleanSupplier;

/**
 * Behavior options of a {@link Translator} built by {@link TranslationResolver}.
 * Every option is optional.
 */
public final class ResolverSettings {

    private final String locale;
    private final String defaultLocale;
    private final boolean showKeysInProd;
    private final boolean showFallbackIndicator;
    private final BiFunction<String, String, String> fallbackIndicatorFormat;
    private final BiPredicate<String, String> shouldShowFallbackIndicator;
    private final boolean applyFallbackOnDev;
    private final BooleanSupplier isProduction;

    private ResolverSettings(Builder builder) {
        this.locale = builder.locale;
        this.defaultLocale = builder.defaultLocale;
        this.showKeysInProd = builder.showKeysInProd;
        this.showFallbackIndicator = builder.showFallbackIndicator;
        this.fallbackIndicatorFormat = builder.fallbackIndicatorFormat;
        this.shouldShowFallbackIndicator = builder.shouldShowFallbackIndicator;
        this.applyFallbackOnDev = builder.applyFallbackOnDev;
        this.isProduction = builder.isProduction;
    }

    public static ResolverSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getLocale() {
        return locale;
    }

    public String getDefaultLocale() {
        return defaultLocale;
    }

    public boolean isShowKeysInProd() {
        return showKeysInProd;
    }

    public boolean isShowFallbackIndicator() {
        return showFallbackIndicator;
    }

    public BiFunction<String, String, String> getFallbackIndicatorFormat() {
        return fallbackIndicatorFormat;
    }

    public BiPredicate<String, String> getShouldShowFallbackIndicator() {
        return shouldShowFallbackIndicator;
    }

    public boolean isApplyFallbackOnDev() {
        return applyFallbackOnDev;
    }

    public BooleanSupplier getIsProduction() {
        return isProduction;
    }

    /**
     * Production behavior applies when the host reports production or when
     * fallback behavior is forced on during development.
     */
    public boolean useProductionBehavior() {
        boolean production = isProduction != null && isProduction.getAsBoolean();
        return production || applyFallbackOnDev;
    }

    public static final class Builder {

        private String locale;
        private String defaultLocale;
        private boolean showKeysInProd;
        private boolean showFallbackIndicator;
        private BiFunction<String, String, String> fallbackIndicatorFormat;
        private BiPredicate<String, String> shouldShowFallbackIndicator;
        private boolean applyFallbackOnDev;
        private BooleanSupplier isProduction;

        private Builder() {
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder defaultLocale(String defaultLocale) {
            this.defaultLocale = defaultLocale;
            return this;
        }

        public Builder showKeysInProd(boolean showKeysInProd) {
            this.showKeysInProd = showKeysInProd;
            return this;
        }

        public Builder showFallbackIndicator(boolean showFallbackIndicator) {
            this.showFallbackIndicator = showFallbackIndicator;
            return this;
        }

        /**
         * @param format receives the fallback text and the default locale
         */
        public Builder fallbackIndicatorFormat(BiFunction<String, String, String> format) {
            this.fallbackIndicatorFormat = format;
            return this;
        }

        /**
         * @param predicate receives the fallback text and the default locale
         */
        public Builder shouldShowFallbackIndicator(BiPredicate<String, String> predicate) {
            this.shouldShowFallbackIndicator = predicate;
            return this;
        }

        public Builder applyFallbackOnDev(boolean applyFallbackOnDev) {
            this.applyFallbackOnDev = applyFallbackOnDev;
            return this;
        }

        public Builder isProduction(BooleanSupplier isProduction) {
            this.isProduction = isProduction;
            return this;
        }

        public ResolverSettings build() {
            return new ResolverSettings(this);
        }
    }
}
