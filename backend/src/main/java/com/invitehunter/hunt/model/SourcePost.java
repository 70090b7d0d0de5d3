package com.invitehunter.hunt.model;

public record SourcePost(String title, String body, String url) {
    public SourcePost {
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        url = url == null ? "" : url;
    }

    public String combinedText() {
        return title + "\n" + body;
    }
}
