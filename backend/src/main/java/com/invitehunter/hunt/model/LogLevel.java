package com.invitehunter.hunt.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LogLevel {
    INFO,
    DEBUG,
    SUCCESS,
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
