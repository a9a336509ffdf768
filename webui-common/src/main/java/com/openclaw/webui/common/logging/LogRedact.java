package com.openclaw.webui.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redaction for frame previews written to the log.
 * Masks credentials and drops base64 payloads before a frame is logged.
 */
public final class LogRedact {

    private LogRedact() {
    }

    /** Frames are previewed at most this many characters. */
    public static final int DEFAULT_PREVIEW_CHARS = 300;

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    // JSON string fields whose values are secrets
    private static final Pattern SECRET_FIELDS = Pattern.compile(
            "\"(token|password|signature|privateKeyPem)\"\\s*:\\s*\"([^\"]*)\"",
            Pattern.CASE_INSENSITIVE);

    // JSON string fields carrying bulk base64 data
    private static final Pattern DATA_FIELDS = Pattern.compile(
            "\"(data)\"\\s*:\\s*\"([^\"]{64,})\"");

    private static final List<Pattern> TOKEN_PATTERNS = List.of(
            Pattern.compile("[?&]token=([^&\\s\"]+)"),
            Pattern.compile("\\bBearer\\s+([A-Za-z0-9._\\-+=]{18,})\\b"));

    /**
     * Redact secrets in a JSON frame or URL.
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = replaceField(text, SECRET_FIELDS, LogRedact::maskToken);
        result = replaceField(result, DATA_FIELDS, value -> "<" + value.length() + " chars>");
        for (Pattern pattern : TOKEN_PATTERNS) {
            Matcher matcher = pattern.matcher(result);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                String token = matcher.group(1);
                String replaced = matcher.group(0).replace(token, maskToken(token));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(replaced));
            }
            matcher.appendTail(sb);
            result = sb.toString();
        }
        return result;
    }

    /**
     * Redacted and truncated preview of a frame for debug logging.
     */
    public static String preview(String frame) {
        return preview(frame, DEFAULT_PREVIEW_CHARS);
    }

    public static String preview(String frame, int maxChars) {
        String redacted = redactSensitiveText(frame);
        if (redacted == null || redacted.length() <= maxChars) {
            return redacted;
        }
        return redacted.substring(0, maxChars) + "…";
    }

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        String start = token.substring(0, KEEP_START);
        String end = token.substring(token.length() - KEEP_END);
        return start + "…" + end;
    }

    private static String replaceField(String text, Pattern pattern,
            java.util.function.UnaryOperator<String> mask) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = "\"" + matcher.group(1) + "\":\"" + mask.apply(matcher.group(2)) + "\"";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
