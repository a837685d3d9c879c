package com.example.i18n.config;

import com.example.i18n.web.TranslationLocaleResolver;
import com.example.translation.merge.LocaleMerger;
import com.example.translation.source.FileSystemSourceTreeReader;
import com.example.translation.source.NamespaceDiscoverer;
import com.example.translation.source.SourceDocumentParser;
import com.example.translation.source.SourceTreeReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.LocaleResolver;

import java.util.Locale;

/**
 * Wires the translation engine into the application context.
 */
@Configuration
public class I18nConfig {

    @Bean
    public SourceTreeReader sourceTreeReader() {
        return new FileSystemSourceTreeReader();
    }

    @Bean
    public SourceDocumentParser sourceDocumentParser(ObjectMapper objectMapper) {
        return new SourceDocumentParser(objectMapper);
    }

    @Bean
    public NamespaceDiscoverer namespaceDiscoverer(SourceTreeReader sourceTreeReader) {
        return new NamespaceDiscoverer(sourceTreeReader);
    }

    @Bean
    public LocaleMerger localeMerger(NamespaceDiscoverer namespaceDiscoverer,
                                     SourceTreeReader sourceTreeReader,
                                     SourceDocumentParser sourceDocumentParser) {
        return new LocaleMerger(namespaceDiscoverer, sourceTreeReader, sourceDocumentParser);
    }

    /**
     * Makes Spring's locale-aware components follow the locale negotiated for translations.
     */
    @Bean
    public LocaleResolver localeResolver(I18nProperties properties) {
        return new TranslationLocaleResolver(Locale.forLanguageTag(properties.getDefaultLanguage()));
    }
}
