package com.yoursp.oauthconnect.modules.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class JsonBodiesTest {

    @Test
    @DisplayName("Body types keep their generic parameters")
    void typesAreParameterized() {
        assertEquals("java.util.Map<java.lang.String, java.lang.Object>", JsonBodies.OBJECT.getType().getTypeName());
        assertEquals("java.util.List<java.util.Map<java.lang.String, java.lang.Object>>",
                JsonBodies.ARRAY.getType().getTypeName());
    }

    @Test
    @DisplayName("An array body is read as a list of JSON objects")
    void readsArrayOfObjects() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("https://api.test/items"))
                .andRespond(withSuccess("[{\"id\":1,\"name\":\"acme\"}]", MediaType.APPLICATION_JSON));

        List<Map<String, Object>> items = restTemplate.exchange("https://api.test/items",
                HttpMethod.GET, null, JsonBodies.ARRAY).getBody();

        assertNotNull(items);
        assertEquals("acme", items.get(0).get("name"));
        assertEquals(1, items.get(0).get("id"));
    }
}
