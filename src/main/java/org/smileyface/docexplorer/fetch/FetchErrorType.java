package org.smileyface.docexplorer.fetch;

/**
 * Classification of fetch failures.
 */
public enum FetchErrorType {
    /** DNS, connection or transport timeout. */
    NETWORK_ERROR,

    /** Non-200 HTTP response. */
    HTTP_STATUS,

    /** Binary or otherwise unexpected content type. */
    NON_TEXT_RESPONSE,

    /** Rendered navigation kept failing. */
    RENDER_TIMEOUT,

    /** The page carries too little text to be useful. */
    EMPTY_CONTENT,

    /** Malformed or unsupported URI. */
    INVALID_URL,

    /** The rendering engine could not be launched. */
    ENGINE_UNAVAILABLE,

    /** The request's global budget expired. */
    DEADLINE_EXCEEDED
}
