package com.yoursp.oauthconnect.modules.provider;

import org.springframework.core.ParameterizedTypeReference;

import java.util.List;
import java.util.Map;

/** Response body types for the untyped JSON the provider APIs return. */
final class JsonBodies {

    static final ParameterizedTypeReference<Map<String, Object>> OBJECT =
            new ParameterizedTypeReference<>() {};

    static final ParameterizedTypeReference<List<Map<String, Object>>> ARRAY =
            new ParameterizedTypeReference<>() {};

    private JsonBodies() {
    }
}
