package com.example.i18n.web;

import com.example.i18n.TranslationService;
import com.example.i18n.common.TranslationLookupService;
import com.example.translation.resolver.ClientPayload;
import com.example.translation.resolver.Translator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/i18n")
public class TranslationController {

    private static final Logger log = LoggerFactory.getLogger(TranslationController.class);

    private final TranslationService translationService;
    private final TranslationLookupService lookupService;

    public TranslationController(TranslationService translationService,
                                 TranslationLookupService lookupService) {
        this.translationService = translationService;
        this.lookupService = lookupService;
    }

    /**
     * Client payload for a route of the negotiated language. Defaults to the request's own path.
     */
    @GetMapping("/payload")
    public ResponseEntity<ClientPayload> payload(@RequestParam(required = false) String path) {
        TranslationState state = lookupService.currentState();
        String routePath = StringUtils.hasText(path) ? path : state.path();
        log.info("Client payload requested: locale={}, path={}", state.locale(), routePath);

        return translationService.clientPayload(state, routePath)
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.debug("Client payload skipped by route fallback policy: path={}", routePath);
                    return ResponseEntity.noContent().build();
                });
    }

    @PostMapping("/resolve")
    public Map<String, String> resolve(@Valid @RequestBody ResolveRequest body) {
        TranslationState state = lookupService.currentState();
        log.info("Resolving translation keys: locale={}, namespace={}, count={}",
                state.locale(), body.namespace(), body.keys().size());

        Translator translator = StringUtils.hasText(body.namespace())
                ? state.translator().namespaced(body.namespace())
                : state.translator();
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String key : body.keys()) {
            resolved.put(key, translator.resolve(key));
        }
        return resolved;
    }

    public record ResolveRequest(
            @NotEmpty List<@NotBlank String> keys,
            String namespace
    ) {
    }
}
