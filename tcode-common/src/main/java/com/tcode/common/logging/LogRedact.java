package com.tcode.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Credential masking for log lines and recorded tunnel traces.
 * <p>
 * Each rule names the capture group that holds the secret; only that group is
 * masked so the surrounding text (header name, JSON key, scheme) stays readable.
 * Private key blocks keep their armor lines and lose the body.
 */
public final class LogRedact {

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;
    private static final String ELLIPSIS = "…";

    private static final Pattern PRIVATE_KEY = Pattern.compile(
            "(-----BEGIN [A-Z ]*PRIVATE KEY-----)[\\s\\S]+?(-----END [A-Z ]*PRIVATE KEY-----)");

    private record Rule(Pattern pattern, int secretGroup) {
        static Rule of(String regex, int secretGroup) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), secretGroup);
        }
    }

    private static final List<Rule> RULES = List.of(
            Rule.of("(Authorization\\s*[:=]\\s*(?:Bearer|token|tunnel)\\s+)([A-Za-z0-9._\\-+/=]+)", 2),
            Rule.of("\\b((?:Bearer|tunnel)\\s+)([A-Za-z0-9._\\-+/=]{18,})", 2),
            Rule.of("\\b(token\\s*[:=]\\s*[\"']?)([A-Za-z0-9._\\-+/=]{18,})", 2),
            Rule.of("(\"(?:token|accessToken|connectAccessToken|managePortsAccessToken)\"\\s*:\\s*\")([^\"]+)", 2),
            Rule.of("\\b(gh[pousr]_[A-Za-z0-9]{20,}|github_pat_[A-Za-z0-9_]{20,})\\b", 1),
            Rule.of("\\b(eyJ[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]{10,})\\b", 1));

    private LogRedact() {
    }

    /**
     * Mask every credential found in {@code text}. Null and empty input is
     * returned as is.
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = PRIVATE_KEY.matcher(text).replaceAll("$1\n" + ELLIPSIS + "redacted" + ELLIPSIS + "\n$2");
        for (Rule rule : RULES) {
            result = apply(rule, result);
        }
        return result;
    }

    /**
     * Short form of a token for logs: the first six and last four characters,
     * or {@code ***} when the token is too short to show any of it.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + ELLIPSIS + token.substring(token.length() - KEEP_END);
    }

    private static String apply(Rule rule, String text) {
        Matcher matcher = rule.pattern().matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        do {
            int start = matcher.start(rule.secretGroup());
            int end = matcher.end(rule.secretGroup());
            out.append(text, last, start).append(maskToken(text.substring(start, end)));
            last = end;
        } while (matcher.find());
        return out.append(text, last, text.length()).toString();
    }
}
