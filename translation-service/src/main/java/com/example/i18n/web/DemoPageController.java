package com.example.i18n.web;

import com.example.i18n.common.TranslationLookupService;
import com.example.translation.resolver.Translator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.ResponseBody;

import static org.springframework.web.util.HtmlUtils.htmlEscape;

/**
 * Server-rendered page showing nested namespaces resolved through scoped translators.
 */
@Controller
public class DemoPageController {

    private static final Logger log = LoggerFactory.getLogger(DemoPageController.class);

    private final TranslationLookupService lookupService;

    public DemoPageController(TranslationLookupService lookupService) {
        this.lookupService = lookupService;
    }

    @GetMapping(value = "/{locale}/test", produces = MediaType.TEXT_HTML_VALUE)
    @ResponseBody
    public String testPage(@PathVariable String locale) {
        TranslationState state = lookupService.currentState();
        log.debug("Rendering test page: requestedLocale={}, locale={}", locale, state.locale());

        Translator t = state.translator();
        Translator actions = t.namespaced("common.actions");
        Translator states = t.namespaced("common.states");
        Translator dashboard = t.namespaced("features.dashboard");
        Translator common = t.namespaced("common");

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html><html><head><title>Nested i18n Test</title></head><body>");
        html.append("<h1>Nested Translation Structure Test</h1>");
        html.append("<p>Current locale: <strong>").append(htmlEscape(state.locale())).append("</strong></p>");

        section(html, "Common Actions", actions, "common.actions", "save", "cancel", "edit");
        section(html, "Common States", states, "common.states", "loading", "success");
        section(html, "Features Namespace", dashboard, "features.dashboard", "title", "welcomeMessage", "stats.users");
        section(html, "Common", common, "common", "welcome", "hello");

        html.append("<p><a href=\"/en/test\">English</a> | <a href=\"/es/test\">Espa&ntilde;ol</a></p>");
        html.append("</body></html>");
        return html.toString();
    }

    private static void section(StringBuilder html, String title, Translator translator, String namespace,
                                String... keys) {
        html.append("<section data-namespace=\"").append(namespace).append("\"><h2>")
                .append(title).append("</h2>");
        for (String key : keys) {
            html.append("<p><code>").append(namespace).append('.').append(key).append("</code>: <span id=\"")
                    .append(namespace).append('.').append(key).append("\">")
                    .append(htmlEscape(translator.resolve(key)))
                    .append("</span></p>");
        }
        html.append("</section>");
    }
}
