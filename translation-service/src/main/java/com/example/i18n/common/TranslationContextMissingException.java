package com.example.i18n.common;

/**
 * Thrown when translations are requested outside a request handled by the i18n filter,
 * for example when the locales directory is missing.
 */
public class TranslationContextMissingException extends RuntimeException {

    public TranslationContextMissingException() {
        super("No translation context is bound to the current request");
    }
}
