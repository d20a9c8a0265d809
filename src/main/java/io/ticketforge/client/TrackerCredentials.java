package io.ticketforge.client;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public record TrackerCredentials(String email, String apiToken) {
    public TrackerCredentials {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("tracker email is required");
        }
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("tracker api token is required");
        }
    }

    public String basicAuthorization() {
        String raw = email.trim() + ":" + apiToken.trim();
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "TrackerCredentials[email=" + email + ", apiToken=***]";
    }
}
