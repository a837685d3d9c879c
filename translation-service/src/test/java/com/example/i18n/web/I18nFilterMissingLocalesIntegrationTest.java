package com.example.i18n.web;

import com.example.i18n.TranslationServiceApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = TranslationServiceApplication.class,
        properties = "i18n.locales-dir=target/no-such-locales")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class I18nFilterMissingLocalesIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testPayload_WithoutLocalesDirectoryReportsMissingContext() throws Exception {
        mockMvc.perform(get("/api/i18n/payload"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("I18N_CONTEXT_MISSING"));
    }
}
