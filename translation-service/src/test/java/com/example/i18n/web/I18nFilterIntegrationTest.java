package com.example.i18n.web;

import com.example.i18n.TranslationServiceApplication;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = TranslationServiceApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class I18nFilterIntegrationTest {

    private static final Logger log = LoggerFactory.getLogger(I18nFilterIntegrationTest.class);

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testPage_SpanishWithPlainFallbackInDevelopment() throws Exception {
        String html = mockMvc.perform(get("/es/test"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andReturn().getResponse().getContentAsString();
        log.info("Rendered page: {}", html);

        assertThat(html).contains("Current locale: <strong>es</strong>");
        assertThat(html).contains("<span id=\"common.actions.save\">Guardar</span>");
        assertThat(html).contains("<span id=\"common.actions.edit\">Edit</span>");
        assertThat(html).contains("<span id=\"common.states.loading\">Loading...</span>");
        assertThat(html).contains("<span id=\"features.dashboard.title\">Panel</span>");
        assertThat(html).contains("<span id=\"features.dashboard.stats.users\">Users</span>");
        assertThat(html).contains("<span id=\"common.hello\">Hola</span>");
    }

    @Test
    void testPage_InjectsRouteTranslationsBeforeHeadClose() throws Exception {
        String html = mockMvc.perform(get("/es/test"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        assertThat(html).contains("</script></head>");
        String script = html.substring(html.indexOf("<script>"), html.indexOf("</script>"));

        assertThat(script).startsWith("<script>window.__I18N__=");
        assertThat(script).contains("\"common.hello\":\"Hola\"");
        assertThat(script).contains("\"common.actions.edit\":\"Edit\"");
        assertThat(script).contains("\"common.states.loading\":\"Loading...\"");
        assertThat(script).contains("\"common.markup\":\"\\u003cb\\u003ebold\\u003c/b\\u003e\"");
        assertThat(script).contains("\"locale\":\"es\"").contains("\"defaultLocale\":\"en\"");
        assertThat(script).doesNotContain("features.dashboard").doesNotContain("pdiModals");
    }

    @Test
    void testPage_UnsupportedLocaleSegmentUsesAcceptLanguage() throws Exception {
        String html = mockMvc.perform(get("/fr/test").header(HttpHeaders.ACCEPT_LANGUAGE, "fr-FR, en;q=0.5"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        assertThat(html).contains("Current locale: <strong>en</strong>");
        assertThat(html).contains("<span id=\"common.hello\">Hello</span>");

        // "/fr/test" is not the "/test" route, so only the always namespaces ship
        String script = html.substring(html.indexOf("<script>"), html.indexOf("</script>"));
        assertThat(script).contains("common.states.success").doesNotContain("common.hello");
    }

    @Test
    void testPayload_AlwaysNamespacesForUnmatchedRoute() throws Exception {
        mockMvc.perform(get("/api/i18n/payload").param("path", "/reports")
                        .header(HttpHeaders.ACCEPT_LANGUAGE, "es"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().string(not(containsString("<script>"))))
                .andExpect(jsonPath("$.locale").value("es"))
                .andExpect(jsonPath("$.defaultLocale").value("en"))
                .andExpect(jsonPath("$.translations['common.states.loading']").value("Loading..."))
                .andExpect(jsonPath("$.translations['common.hello']").doesNotExist());
    }

    @Test
    void testPayload_WildcardRouteByAcceptLanguageWeight() throws Exception {
        mockMvc.perform(get("/api/i18n/payload").param("path", "/indicators/5")
                        .header(HttpHeaders.ACCEPT_LANGUAGE, "fr-CA;q=0.9, es;q=0.8, en;q=0.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locale").value("es"))
                .andExpect(jsonPath("$.translations['features.indicators.list.title']").value("Indicators"))
                .andExpect(jsonPath("$.translations['common.states.success']").value("Success!"))
                .andExpect(jsonPath("$.translations['features.dashboard.title']").doesNotExist());
    }

    @Test
    void testPayload_BareDirectoryMatchesWildcardRoute() throws Exception {
        mockMvc.perform(get("/api/i18n/payload").param("path", "/indicators"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locale").value("en"))
                .andExpect(jsonPath("$.translations['features.indicators.list.empty']").value("No indicators yet"));
    }

    @Test
    void testResolve_NamespacedKeys() throws Exception {
        mockMvc.perform(post("/api/i18n/resolve")
                        .header(HttpHeaders.ACCEPT_LANGUAGE, "es")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keys\":[\"save\",\"edit\",\"missing\"],\"namespace\":\"common.actions\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.save").value("Guardar"))
                .andExpect(jsonPath("$.edit").value("Edit"))
                .andExpect(jsonPath("$.missing").value("[common.actions.missing]"));
    }

    @Test
    void testResolve_FullKeysWithoutNamespace() throws Exception {
        mockMvc.perform(post("/api/i18n/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keys\":[\"common.hello\",\"pdiModals.confirm\",\"common\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['common.hello']").value("Hello"))
                .andExpect(jsonPath("$['pdiModals.confirm']").value("Confirm"))
                .andExpect(jsonPath("$.common").value("[common]"));
    }

    @Test
    void testResolve_EmptyKeysRejected() throws Exception {
        mockMvc.perform(post("/api/i18n/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keys\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.path").value("/api/i18n/resolve"));
    }

    @Test
    void testResolve_MalformedBodyRejected() throws Exception {
        mockMvc.perform(post("/api/i18n/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keys\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.errorCode").value("MALFORMED_REQUEST"));
    }

    @Test
    void testUnsupportedMethod() throws Exception {
        mockMvc.perform(delete("/api/i18n/payload"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("Method Not Allowed"))
                .andExpect(jsonPath("$.errorCode").value("METHOD_NOT_ALLOWED"));
    }
}
