package com.example.i18n.locale;

import com.example.i18n.config.I18nProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Picks the language of a request: a supported first path segment wins, then the
 * highest-weighted supported {@code Accept-Language} entry, then the default language.
 */
@Component
public class LocaleNegotiator {

    private static final Logger log = LoggerFactory.getLogger(LocaleNegotiator.class);

    private final List<String> languages;
    private final String defaultLanguage;

    @Autowired
    public LocaleNegotiator(I18nProperties properties) {
        this(properties.getLanguages(), properties.getDefaultLanguage());
    }

    public LocaleNegotiator(List<String> languages, String defaultLanguage) {
        this.languages = List.copyOf(languages);
        this.defaultLanguage = defaultLanguage;
    }

    public LocaleMatch negotiate(String requestPath, String acceptLanguage) {
        List<String> segments = Arrays.stream((requestPath == null ? "" : requestPath).split("/"))
                .filter(StringUtils::hasLength)
                .collect(Collectors.toList());

        if (!segments.isEmpty() && languages.contains(segments.get(0))) {
            String rest = "/" + String.join("/", segments.subList(1, segments.size()));
            return new LocaleMatch(segments.get(0), rest, true);
        }

        String path = StringUtils.hasLength(requestPath) ? requestPath : "/";
        String preferred = preferredLanguage(acceptLanguage);
        log.debug("Locale negotiated from Accept-Language: path={}, acceptLanguage={}, locale={}",
                path, acceptLanguage, preferred);
        return new LocaleMatch(preferred, path, false);
    }

    /**
     * Resolves an {@code Accept-Language} header such as {@code "fr-CA;q=0.4, es;q=0.9, en;q=0.8"}
     * against the supported languages, comparing primary subtags only.
     */
    String preferredLanguage(String acceptLanguage) {
        if (!StringUtils.hasText(acceptLanguage)) {
            return defaultLanguage;
        }

        List<WeightedLanguage> weighted = new ArrayList<>();
        for (String part : acceptLanguage.split(",")) {
            String[] codeAndWeight = part.trim().split(";q=");
            String code = codeAndWeight[0].trim().toLowerCase(Locale.ROOT);
            if (code.isEmpty()) {
                continue;
            }
            weighted.add(new WeightedLanguage(code, codeAndWeight.length > 1 ? parseWeight(codeAndWeight[1]) : 1.0));
        }
        weighted.sort(Comparator.comparingDouble(WeightedLanguage::weight).reversed());

        for (WeightedLanguage language : weighted) {
            String primary = language.code().split("-")[0];
            if (languages.contains(primary)) {
                return primary;
            }
        }
        return defaultLanguage;
    }

    private static double parseWeight(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }

    private record WeightedLanguage(String code, double weight) {
    }
}
