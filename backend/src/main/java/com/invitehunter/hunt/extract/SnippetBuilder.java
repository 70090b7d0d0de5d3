package com.invitehunter.hunt.extract;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class SnippetBuilder {
    static final int CONTEXT_RADIUS = 60;
    static final int FALLBACK_LENGTH = 200;
    private static final String MARK_OPEN = "<mark>";
    private static final String MARK_CLOSE = "</mark>";
    private static final String ENCODING = "UTF-8";

    public String build(String title, String body, String token) {
        String safeTitle = title == null ? "" : title;
        String safeBody = body == null ? "" : body;
        String safeToken = token == null ? "" : token;

        String combined = (safeTitle + "\n" + safeBody).strip();
        if (combined.isEmpty()) {
            return escape(safeTitle.isEmpty() ? safeToken : safeTitle);
        }
        if (safeToken.isEmpty()) {
            return escape(window(combined, 0, Math.min(combined.length(), FALLBACK_LENGTH)));
        }

        Pattern pattern = Pattern.compile(Pattern.quote(safeToken), Pattern.CASE_INSENSITIVE);
        Matcher first = pattern.matcher(combined);
        String snippet;
        if (first.find()) {
            int start = Math.max(first.start() - CONTEXT_RADIUS, 0);
            int end = Math.min(first.end() + CONTEXT_RADIUS, combined.length());
            snippet = window(combined, start, end);
        } else {
            snippet = window(combined, 0, Math.min(combined.length(), FALLBACK_LENGTH));
        }
        return highlight(snippet, pattern);
    }

    private static String escape(String text) {
        return HtmlUtils.htmlEscape(text, ENCODING);
    }

    private String window(String text, int start, int end) {
        return text.substring(start, end).replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').strip();
    }

    private String highlight(String snippet, Pattern pattern) {
        StringBuilder out = new StringBuilder(snippet.length() + 32);
        Matcher matcher = pattern.matcher(snippet);
        int lastEnd = 0;
        while (matcher.find()) {
            out.append(escape(snippet.substring(lastEnd, matcher.start())));
            out.append(MARK_OPEN).append(escape(matcher.group())).append(MARK_CLOSE);
            lastEnd = matcher.end();
        }
        out.append(escape(snippet.substring(lastEnd)));
        return out.toString();
    }
}
