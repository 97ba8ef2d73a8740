package org.smileyface.docexplorer.fetch;

import java.util.Objects;

/**
 * A page could not be fetched; {@link #getType()} tells why.
 */
public class FetchException extends Exception {

    private final FetchErrorType type;

    public FetchException(FetchErrorType type, String message) {
        super(message);
        this.type = Objects.requireNonNull(type, "type");
    }

    public FetchException(FetchErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = Objects.requireNonNull(type, "type");
    }

    public FetchErrorType getType() {
        return type;
    }
}
