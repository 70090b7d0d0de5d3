package com.invitehunter.hunt.extract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls invite-code shaped tokens out of free text: word-bounded runs of 5 to 12
 * uppercase letters or digits that contain at least one digit. Runs that carry
 * URL or markup fragments are dropped.
 */
@Component
public class TokenExtractor {
    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\b[A-Z0-9]{5,12}\\b");
    private static final List<String> EXCLUDED_FRAGMENTS = List.of("HTTP", "HTTPS", "HTML", "JSON", "XML");

    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        Matcher matcher = TOKEN_PATTERN.matcher(text.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (isAcceptable(token)) {
                unique.add(token);
            }
        }
        return new ArrayList<>(unique);
    }

    public static boolean isAcceptable(String token) {
        if (token == null || token.length() < 5 || token.length() > 12) {
            return false;
        }
        if (!containsDigit(token)) {
            return false;
        }
        for (String fragment : EXCLUDED_FRAGMENTS) {
            if (token.contains(fragment)) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsDigit(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (Character.isDigit(token.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
