package com.example.i18n.config;

import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Tells the translation engine whether production behavior applies.
 * {@code i18n.production} wins when set; otherwise the {@code prod} profile decides.
 */
@Component
public class ProductionModeDetector {

    static final String PRODUCTION_PROFILE = "prod";

    private final Environment environment;
    private final I18nProperties properties;

    public ProductionModeDetector(Environment environment, I18nProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    public boolean isProduction() {
        if (properties.getProduction() != null) {
            return properties.getProduction();
        }
        return environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE));
    }
}
