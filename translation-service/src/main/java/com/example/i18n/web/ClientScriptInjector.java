package com.example.i18n.web;

import com.example.translation.resolver.ClientPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Embeds a {@link ClientPayload} into an HTML document as
 * {@code <script>window.__I18N__=...;</script>}.
 */
@Component
public class ClientScriptInjector {

    static final String GLOBAL_NAME = "window.__I18N__";

    private static final String HEAD_CLOSE = "</head>";
    private static final Pattern BODY_OPEN = Pattern.compile("<body([^>]*)>");

    private final ObjectMapper objectMapper;

    public ClientScriptInjector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts the script before {@code </head>}, else right after the opening {@code <body>}
     * tag, else at the start of the document.
     */
    public String inject(String html, ClientPayload payload) {
        String scriptTag = scriptTag(payload);

        int headClose = html.indexOf(HEAD_CLOSE);
        if (headClose >= 0) {
            return html.substring(0, headClose) + scriptTag + html.substring(headClose);
        }

        Matcher body = BODY_OPEN.matcher(html);
        if (body.find()) {
            return html.substring(0, body.end()) + scriptTag + html.substring(body.end());
        }

        return scriptTag + html;
    }

    String scriptTag(ClientPayload payload) {
        return "<script>" + GLOBAL_NAME + "=" + toScriptSafeJson(payload) + ";</script>";
    }

    /**
     * Serializes the payload with {@code <} and {@code >} escaped so no value can close the script element.
     */
    String toScriptSafeJson(ClientPayload payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Client translation payload could not be serialized", ex);
        }
        return json.replace("<", "\\u003c").replace(">", "\\u003e");
    }
}
