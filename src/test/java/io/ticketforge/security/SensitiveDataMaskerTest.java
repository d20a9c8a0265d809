package io.ticketforge.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.ticketforge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() throws Exception {
        JsonNode input = Jsons.mapper().readTree("""
                {"request": {"headers": {"Authorization": "Basic abc"}, "apiToken": "t0k3n"},
                 "attempts": 3,
                 "notes": ["Bearer eyJhbGciOiJIUzI1NiJ9.payload", "plain"]}
                """);

        JsonNode out = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("***", out.path("request").path("headers").path("Authorization").asText());
        Assertions.assertEquals("***", out.path("request").path("apiToken").asText());
        Assertions.assertEquals(3, out.path("attempts").asInt());
        Assertions.assertEquals("Bearer ***", out.path("notes").get(0).asText());
        Assertions.assertEquals("plain", out.path("notes").get(1).asText());
    }

    @Test
    void issueKeysAreNotTreatedAsSecrets() throws Exception {
        JsonNode out = SensitiveDataMasker.masked(Jsons.mapper().readTree("{\"remote_key\": \"MIG-1\"}"));
        Assertions.assertEquals("MIG-1", out.path("remote_key").asText());
    }
}
