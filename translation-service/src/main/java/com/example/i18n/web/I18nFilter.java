package com.example.i18n.web;

import com.example.i18n.TranslationService;
import com.example.i18n.locale.LocaleMatch;
import com.example.i18n.locale.LocaleNegotiator;
import com.example.translation.resolver.ClientPayload;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Builds the translation state of every request and, when client loading is enabled,
 * injects the route's translations into HTML responses.
 *
 * <p>The state is exposed as request attribute {@link TranslationState#ATTRIBUTE} and
 * through {@link TranslationContextHolder} for the duration of the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class I18nFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(I18nFilter.class);

    private final TranslationService translationService;
    private final LocaleNegotiator localeNegotiator;
    private final ClientScriptInjector clientScriptInjector;

    public I18nFilter(TranslationService translationService,
                      LocaleNegotiator localeNegotiator,
                      ClientScriptInjector clientScriptInjector) {
        this.translationService = translationService;
        this.localeNegotiator = localeNegotiator;
        this.clientScriptInjector = clientScriptInjector;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!translationService.isLocalesDirAvailable()) {
            log.error("Could not find locales directory, serving request without translations: uri={}",
                    request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        String requestPath = request.getRequestURI().substring(request.getContextPath().length());
        LocaleMatch match = localeNegotiator.negotiate(requestPath, request.getHeader(HttpHeaders.ACCEPT_LANGUAGE));
        TranslationState state = translationService.buildState(match.locale(), match.path());

        request.setAttribute(TranslationState.ATTRIBUTE, state);
        TranslationContextHolder.set(state);
        try {
            if (!translationService.isClientLoadEnabled()) {
                filterChain.doFilter(request, response);
                return;
            }

            ContentCachingResponseWrapper wrapped = new ContentCachingResponseWrapper(response);
            filterChain.doFilter(request, wrapped);
            if (isHtml(wrapped.getContentType())) {
                injectClientTranslations(wrapped, state);
            }
            wrapped.copyBodyToResponse();
        } finally {
            TranslationContextHolder.clear();
        }
    }

    private void injectClientTranslations(ContentCachingResponseWrapper response, TranslationState state)
            throws IOException {
        Optional<ClientPayload> payload = translationService.clientPayload(state, state.path());
        if (payload.isEmpty()) {
            return;
        }

        Charset charset = charsetOf(response);
        String html = new String(response.getContentAsByteArray(), charset);
        String modified = clientScriptInjector.inject(html, payload.get());

        response.resetBuffer();
        response.getOutputStream().write(modified.getBytes(charset));
        log.debug("Client translations injected: path={}, locale={}, keys={}",
                state.path(), state.locale(), payload.get().translations().size());
    }

    private static boolean isHtml(String contentType) {
        if (contentType == null) {
            return false;
        }
        try {
            return MediaType.TEXT_HTML.includes(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException ex) {
            log.debug("Unparsable response content type ignored: contentType={}", contentType);
            return false;
        }
    }

    private static Charset charsetOf(HttpServletResponse response) {
        String encoding = response.getCharacterEncoding();
        try {
            return encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown response encoding, using UTF-8: encoding={}", encoding);
            return StandardCharsets.UTF_8;
        }
    }
}
