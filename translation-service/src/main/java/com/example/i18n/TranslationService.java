package com.example.i18n;

import com.example.i18n.config.FallbackIndicatorPolicy;
import com.example.i18n.config.I18nProperties;
import com.example.i18n.config.ProductionModeDetector;
import com.example.i18n.web.TranslationState;
import com.example.translation.merge.LocaleMerger;
import com.example.translation.merge.MergedTranslations;
import com.example.translation.resolver.ClientPayload;
import com.example.translation.resolver.ResolverSettings;
import com.example.translation.resolver.TranslationResolver;
import com.example.translation.resolver.Translator;
import com.example.translation.route.ClientLoadConfig;
import com.example.translation.route.FallbackPolicy;
import com.example.translation.route.NamespaceSelection;
import com.example.translation.route.RouteNamespaceSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the translation state of a request and the payload shipped to client code.
 */
@Service
public class TranslationService {

    private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

    private static final Pattern INDICATOR_PLACEHOLDER = Pattern.compile("\\{(text|locale)\\}");

    private final I18nProperties properties;
    private final LocaleMerger localeMerger;
    private final ProductionModeDetector productionModeDetector;
    private final FallbackIndicatorPolicy indicatorPolicy;
    private final ClientLoadConfig clientLoadConfig;
    private final Path localesDir;

    public TranslationService(I18nProperties properties,
                              LocaleMerger localeMerger,
                              ProductionModeDetector productionModeDetector,
                              ObjectProvider<FallbackIndicatorPolicy> indicatorPolicy) {
        this.properties = properties;
        this.localeMerger = localeMerger;
        this.productionModeDetector = productionModeDetector;
        this.indicatorPolicy = indicatorPolicy.getIfAvailable(() -> thresholdPolicy(properties.getFallback()));
        this.clientLoadConfig = toClientLoadConfig(properties.getClientLoad());
        this.localesDir = Paths.get(properties.getLocalesDir());
        log.info("TranslationService initialized: languages={}, defaultLanguage={}, localesDir={}, fallbackEnabled={}, clientLoad={}",
                properties.getLanguages(), properties.getDefaultLanguage(), localesDir.toAbsolutePath(),
                properties.getFallback().isEnabled(), clientLoadConfig != null);
    }

    public boolean isLocalesDirAvailable() {
        return Files.isDirectory(localesDir);
    }

    /**
     * Merges the locale folders and creates the request translator.
     *
     * @param locale negotiated language
     * @param path   request path without the locale segment
     */
    public TranslationState buildState(String locale, String path) {
        String defaultLanguage = properties.getDefaultLanguage();
        I18nProperties.Fallback fallback = properties.getFallback();

        MergedTranslations translations = localeMerger.merge(localesDir, locale, defaultLanguage, fallback.isEnabled());
        log.debug("Request translations built: locale={}, path={}, keys={}, fallbackKeys={}",
                locale, path, translations.size(), translations.getFallbackKeys().size());

        return new TranslationState(locale, defaultLanguage, path, translations, createTranslator(locale, translations));
    }

    Translator createTranslator(String locale, MergedTranslations translations) {
        I18nProperties.Fallback fallback = properties.getFallback();
        String format = fallback.getIndicatorFormat();
        ResolverSettings settings = ResolverSettings.builder()
                .locale(locale)
                .defaultLocale(properties.getDefaultLanguage())
                .showKeysInProd(properties.isShowKeysInProd())
                .showFallbackIndicator(fallback.isShowIndicator() && fallback.isEnabled())
                .fallbackIndicatorFormat(format == null ? null
                        : (text, defaultLocale) -> formatIndicator(format, text, defaultLocale))
                .shouldShowFallbackIndicator(indicatorPolicy == null ? null : indicatorPolicy::shouldShow)
                .applyFallbackOnDev(fallback.isApplyOnDev())
                .isProduction(productionModeDetector::isProduction)
                .build();
        return TranslationResolver.create(translations, settings);
    }

    public boolean isClientLoadEnabled() {
        return clientLoadConfig != null;
    }

    /**
     * Client payload for a route, or empty when the route's selection says to skip it.
     */
    public Optional<ClientPayload> clientPayload(TranslationState state, String path) {
        boolean isDev = !productionModeDetector.isProduction();
        NamespaceSelection selection = RouteNamespaceSelector.selectNamespaces(path, clientLoadConfig, isDev);
        if (selection.isSkip()) {
            log.debug("Client translations skipped: path={}", path);
            return Optional.empty();
        }

        Map<String, String> extracted = RouteNamespaceSelector.extractNamespaces(
                state.translations().getTable(), selection.getNamespaces());
        log.debug("Client translations selected: path={}, selection={}, keys={}", path, selection, extracted.size());
        return Optional.of(new ClientPayload(new LinkedHashMap<String, Object>(extracted), state.locale(), state.defaultLocale()));
    }

    /**
     * Fills {@code {text}} and {@code {locale}} in one pass over the template, so placeholders
     * inside the substituted values stay as they are.
     */
    static String formatIndicator(String format, String text, String defaultLocale) {
        Matcher matcher = INDICATOR_PLACEHOLDER.matcher(format);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = "text".equals(matcher.group(1)) ? text : defaultLocale;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static FallbackIndicatorPolicy thresholdPolicy(I18nProperties.Fallback fallback) {
        if (fallback.getMinIndicatorWords() <= 0 && fallback.getMinIndicatorLetters() <= 0) {
            return null;
        }
        return FallbackIndicatorPolicy.minimumLength(fallback.getMinIndicatorWords(), fallback.getMinIndicatorLetters());
    }

    private static ClientLoadConfig toClientLoadConfig(I18nProperties.ClientLoad clientLoad) {
        if (!clientLoad.isEnabled()) {
            return null;
        }
        Map<String, List<String>> routes = new LinkedHashMap<>();
        for (I18nProperties.Route route : clientLoad.getRoutes()) {
            if (routes.containsKey(route.getPattern())) {
                log.warn("Duplicate client load route pattern, later entry wins: pattern={}", route.getPattern());
            }
            routes.put(route.getPattern(), route.getNamespaces());
        }
        return new ClientLoadConfig(
                clientLoad.getAlways(),
                routes,
                FallbackPolicy.from(clientLoad.getFallback()),
                clientLoad.isIgnoreTrailingSlash(),
                clientLoad.isWarnOnOverlap());
    }
}
