package io.ticketforge.client;

/**
 * Non-2xx answer from the tracker, raised inside a single attempt and
 * classified by {@link RemoteCallExecutor}.
 */
public final class RemoteStatusException extends RuntimeException {
    private final int statusCode;
    private final String body;
    private final long retryAfterMs;

    public RemoteStatusException(int statusCode, String body, long retryAfterMs) {
        super("HTTP " + statusCode + (body == null || body.isBlank() ? "" : " " + abbreviate(body)));
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
        this.retryAfterMs = retryAfterMs;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }

    public long retryAfterMs() {
        return retryAfterMs;
    }

    public boolean isTransient() {
        return statusCode == 429 || statusCode >= 500;
    }

    private static String abbreviate(String raw) {
        String flat = raw.replace('\r', ' ').replace('\n', ' ').trim();
        return flat.length() <= 512 ? flat : flat.substring(0, 512) + "...";
    }
}
