package com.example.i18n.common;

import com.example.i18n.web.TranslationContextHolder;
import com.example.i18n.web.TranslationState;
import org.springframework.stereotype.Service;

/**
 * Service to access the translations of the current request.
 * Provides centralized text lookup for controllers and services.
 */
@Service
public class TranslationLookupService {

    /**
     * Get the translation state bound to the current request.
     *
     * @return the state
     * @throws TranslationContextMissingException if no request context is bound
     */
    public TranslationState currentState() {
        TranslationState state = TranslationContextHolder.get();
        if (state == null) {
            throw new TranslationContextMissingException();
        }
        return state;
    }

    /**
     * Get message by key.
     *
     * @param key the full translation key
     * @return the resolved text
     */
    public String getMessage(String key) {
        return currentState().translator().resolve(key);
    }

    /**
     * Get message by key inside a namespace.
     *
     * @param namespace the namespace prefix, e.g. {@code common.actions}
     * @param key the key relative to the namespace
     * @return the resolved text
     */
    public String getMessage(String namespace, String key) {
        return currentState().translator().namespaced(namespace).resolve(key);
    }

    public String currentLocale() {
        return currentState().locale();
    }
}
