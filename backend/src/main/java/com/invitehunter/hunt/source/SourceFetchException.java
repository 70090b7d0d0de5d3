package com.invitehunter.hunt.source;

public class SourceFetchException extends Exception {
    private final String reasonCode;

    public SourceFetchException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public SourceFetchException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
