package io.ticketforge.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalises text copied out of spreadsheets and JSON before it is sent to the
 * tracker: typographic quotes, escaped newlines, stray control characters and
 * wrapping quotes are all common in migration templates.
 */
public final class TextSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f]");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\n{3,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:]+$");
    private static final Pattern SCHEME = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern REST_API_SUFFIX = Pattern.compile("/rest/api/[23]/?$", Pattern.CASE_INSENSITIVE);

    private TextSanitizer() {
    }

    public static String multiline(String value) {
        return sanitize(value, true);
    }

    public static String singleLine(String value) {
        return sanitize(value, false);
    }

    /**
     * Issue and project keys: single line, no whitespace, no trailing punctuation.
     */
    public static String key(String value) {
        String text = singleLine(value);
        text = TRAILING_PUNCTUATION.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll("");
    }

    /**
     * Renders multi-line text as a bullet list unless it already is one.
     */
    public static String bullets(String value) {
        List<String> lines = new ArrayList<>();
        for (String line : multiline(value).split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        if (lines.size() <= 1) {
            return String.join("\n", lines);
        }
        boolean alreadyBulleted = lines.stream().allMatch(l -> l.startsWith("* ") || l.startsWith("- "));
        if (alreadyBulleted) {
            return String.join("\n", lines);
        }
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            out.add("* " + line);
        }
        return String.join("\n", out);
    }

    /**
     * Accepts a site root or a REST root, with or without scheme, and returns
     * the site root without a trailing slash.
     */
    public static String baseUrl(String raw) {
        String normalized = singleLine(raw);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("tracker base URL is required");
        }
        if (!SCHEME.matcher(normalized).find()) {
            normalized = "https://" + normalized;
        }
        normalized = REST_API_SUFFIX.matcher(normalized).replaceAll("");
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public static boolean equalsIgnoreCase(String a, String b) {
        return singleLine(a).toLowerCase(Locale.ROOT).equals(singleLine(b).toLowerCase(Locale.ROOT));
    }

    private static String sanitize(String value, boolean multiline) {
        if (value == null) {
            return "";
        }
        String text = value
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\u201c', '"')
                .replace('\u201d', '"')
                .replace('\u00a0', ' ');
        text = text.replace("\\r\\n", "\n").replace("\\n", "\n").replace("\\t", "\t");
        text = text.replace("\\\"", "\"").replace("\\'", "'");
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = text.strip();
        while (text.length() >= 2 && text.charAt(0) == text.charAt(text.length() - 1)
                && (text.charAt(0) == '"' || text.charAt(0) == '\'' || text.charAt(0) == '`')) {
            text = text.substring(1, text.length() - 1).strip();
        }
        if (multiline) {
            String[] lines = text.split("\n", -1);
            StringBuilder sb = new StringBuilder(text.length());
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    sb.append('\n');
                }
                sb.append(lines[i].stripTrailing());
            }
            text = BLANK_LINE_RUNS.matcher(sb.toString()).replaceAll("\n\n").strip();
        } else {
            text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        }
        return text;
    }
}
