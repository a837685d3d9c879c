package com.example.i18n.web;

/**
 * Thread-bound {@link TranslationState} of the request being served, so services can
 * translate without receiving the request. Set and cleared by {@link I18nFilter}.
 */
public final class TranslationContextHolder {

    private static final ThreadLocal<TranslationState> CTX = new ThreadLocal<>();

    private TranslationContextHolder() {
    }

    public static void set(TranslationState state) {
        CTX.set(state);
    }

    public static TranslationState get() {
        return CTX.get();
    }

    public static void clear() {
        CTX.remove();
    }
}
