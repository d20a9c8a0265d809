package io.ticketforge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ticketforge.model.RecordKind;
import io.ticketforge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TrackerClient} over the Jira REST API. Field ids and link type names
 * are looked up once per client and cached.
 */
public final class JiraTrackerClient implements TrackerClient {
    private static final Logger log = LoggerFactory.getLogger(JiraTrackerClient.class);
    static final String EPIC_LINK_FIELD = "Epic Link";

    private final String apiRoot;
    private final TrackerCredentials credentials;
    private final RemoteCallExecutor executor;
    private final Duration requestTimeout;
    private final HttpClient http;
    private final Map<String, String> fieldIdCache = new ConcurrentHashMap<>();
    private volatile List<LinkTypeInfo> linkTypeCache;

    public JiraTrackerClient(String baseUrl, String apiVersion, TrackerCredentials credentials,
                             RemoteCallExecutor executor, Duration requestTimeout, Duration connectTimeout) {
        this(baseUrl, apiVersion, credentials, executor, requestTimeout, HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    JiraTrackerClient(String baseUrl, String apiVersion, TrackerCredentials credentials,
                      RemoteCallExecutor executor, Duration requestTimeout, HttpClient http) {
        String version = apiVersion == null || apiVersion.isBlank() ? "2" : apiVersion.trim();
        this.apiRoot = TextSanitizer.baseUrl(baseUrl) + "/rest/api/" + version;
        this.credentials = credentials;
        this.executor = executor;
        this.requestTimeout = requestTimeout;
        this.http = http;
    }

    @Override
    public String create(RecordKind kind, CreateRequest request) {
        ObjectNode fields = Jsons.mapper().createObjectNode();
        fields.putObject("project").put("key", TextSanitizer.key(request.projectKey()));
        fields.putObject("issuetype").put("name", kind.issueTypeName());
        fields.put("summary", TextSanitizer.singleLine(request.summary()));
        fields.put("description", TextSanitizer.multiline(request.description()));
        List<String> labels = new ArrayList<>();
        for (String label : request.labels()) {
            String clean = TextSanitizer.singleLine(label);
            if (!clean.isEmpty()) {
                labels.add(clean);
            }
        }
        if (!labels.isEmpty()) {
            ArrayNode labelNode = fields.putArray("labels");
            labels.forEach(labelNode::add);
        }
        if (request.parentKey() != null && !request.parentKey().isBlank()) {
            fields.putObject("parent").put("key", TextSanitizer.key(request.parentKey()));
        }
        if (request.epicKey() != null && !request.epicKey().isBlank()) {
            fields.put(fieldId(EPIC_LINK_FIELD), TextSanitizer.key(request.epicKey()));
        }
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.set("fields", fields);

        JsonNode response = executor.execute("create " + kind.code(), () -> send("POST", "/issue", body));
        String key = TextSanitizer.singleLine(response.path("key").asText(""));
        if (key.isEmpty()) {
            throw new PermanentFailureException("create " + kind.code() + " response did not contain an issue key", 0);
        }
        log.debug("Created {} {}", kind.code(), key);
        return key;
    }

    @Override
    public LinkResult link(String sourceKey, String targetKey, List<String> typeCandidates) {
        String inward = TextSanitizer.key(sourceKey);
        String outward = TextSanitizer.key(targetKey);
        Set<String> names = new LinkedHashSet<>();
        for (String candidate : typeCandidates) {
            String raw = TextSanitizer.singleLine(candidate);
            if (raw.isEmpty()) {
                continue;
            }
            names.add(resolveLinkTypeName(raw));
            names.add(raw);
        }
        List<String> attempted = new ArrayList<>();
        PermanentFailureException lastRejection = null;
        for (String name : names) {
            if (attempted.stream().anyMatch(a -> a.equalsIgnoreCase(name))) {
                continue;
            }
            attempted.add(name);
            ObjectNode body = Jsons.mapper().createObjectNode();
            body.putObject("type").put("name", name);
            body.putObject("inwardIssue").put("key", inward);
            body.putObject("outwardIssue").put("key", outward);
            try {
                executor.execute("link " + inward + " -> " + outward, () -> send("POST", "/issueLink", body));
                return new LinkResult(name, attempted);
            } catch (PermanentFailureException e) {
                log.info("Link type '{}' rejected for {} -> {}: {}", name, inward, outward, e.getMessage());
                lastRejection = e;
            }
        }
        throw new LinkTypeMismatchException(inward, outward, attempted, lastRejection);
    }

    @Override
    public void setField(String key, String fieldName, String value) {
        String issueKey = TextSanitizer.key(key);
        String id = fieldId(fieldName);
        String base = TextSanitizer.multiline(value);
        Set<String> variants = new LinkedHashSet<>();
        variants.add(base);
        variants.add(TextSanitizer.singleLine(value));
        variants.add(base.replace("\"", "").replace("'", ""));
        variants.removeIf(String::isBlank);
        if (variants.isEmpty()) {
            return;
        }
        PermanentFailureException lastRejection = null;
        for (String variant : variants) {
            ObjectNode body = Jsons.mapper().createObjectNode();
            body.putObject("fields").put(id, variant);
            try {
                executor.execute("set " + fieldName + " on " + issueKey,
                        () -> send("PUT", "/issue/" + URLEncoder.encode(issueKey, StandardCharsets.UTF_8), body));
                return;
            } catch (PermanentFailureException e) {
                lastRejection = e;
            }
        }
        throw new PermanentFailureException(
                "Failed to set " + fieldName + " on " + issueKey + ": " + lastRejection.getMessage(),
                lastRejection.statusCode(),
                lastRejection
        );
    }

    String fieldId(String fieldName) {
        String wanted = TextSanitizer.singleLine(fieldName).toLowerCase(Locale.ROOT);
        String cached = fieldIdCache.get(wanted);
        if (cached != null) {
            return cached;
        }
        JsonNode fields = executor.execute("list fields", () -> send("GET", "/field", null));
        for (JsonNode field : fields) {
            String name = TextSanitizer.singleLine(field.path("name").asText("")).toLowerCase(Locale.ROOT);
            String id = field.path("id").asText("");
            if (!name.isEmpty() && !id.isEmpty()) {
                fieldIdCache.putIfAbsent(name, id);
            }
        }
        String id = fieldIdCache.get(wanted);
        if (id == null) {
            throw new PermanentFailureException("Tracker field not found: " + fieldName, 404);
        }
        return id;
    }

    /**
     * Maps a preferred name to the catalogue name whose name, inward or
     * outward description matches it; returns the input when nothing matches.
     */
    String resolveLinkTypeName(String preferred) {
        for (LinkTypeInfo type : linkTypes()) {
            if (TextSanitizer.equalsIgnoreCase(preferred, type.name())
                    || TextSanitizer.equalsIgnoreCase(preferred, type.inward())
                    || TextSanitizer.equalsIgnoreCase(preferred, type.outward())) {
                return type.name();
            }
        }
        return preferred;
    }

    private List<LinkTypeInfo> linkTypes() {
        List<LinkTypeInfo> cached = linkTypeCache;
        if (cached != null) {
            return cached;
        }
        List<LinkTypeInfo> loaded = new ArrayList<>();
        try {
            JsonNode data = executor.execute("list link types", () -> send("GET", "/issueLinkType", null));
            for (JsonNode entry : data.path("issueLinkTypes")) {
                String name = TextSanitizer.singleLine(entry.path("name").asText(""));
                if (!name.isEmpty()) {
                    loaded.add(new LinkTypeInfo(
                            name,
                            TextSanitizer.singleLine(entry.path("inward").asText("")),
                            TextSanitizer.singleLine(entry.path("outward").asText(""))
                    ));
                }
            }
        } catch (PermanentFailureException e) {
            log.warn("Link type catalogue unavailable, using candidate names as given: {}", e.getMessage());
        }
        linkTypeCache = List.copyOf(loaded);
        return linkTypeCache;
    }

    private JsonNode send(String method, String path, JsonNode body) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(apiRoot + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .header("Authorization", credentials.basicAuthorization());
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json");
            builder.method(method, HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8));
        }
        HttpResponse<String> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int status = response.statusCode();
        if (status >= 400) {
            throw new RemoteStatusException(status, response.body(), retryAfterMs(response));
        }
        String text = response.body();
        if (status == 204 || text == null || text.isBlank()) {
            return Jsons.mapper().missingNode();
        }
        try {
            return Jsons.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new PermanentFailureException("Unreadable response from " + method + " " + path, status, e);
        }
    }

    private static long retryAfterMs(HttpResponse<String> response) {
        String raw = response.headers().firstValue("Retry-After").orElse("");
        if (raw.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(raw.trim())) * 1_000L;
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private record LinkTypeInfo(String name, String inward, String outward) {
    }
}
