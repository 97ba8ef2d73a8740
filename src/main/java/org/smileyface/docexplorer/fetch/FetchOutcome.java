package org.smileyface.docexplorer.fetch;

import java.util.Objects;

/**
 * Result of a single fetch attempt. {@link Retryable} failures let the caller try another strategy,
 * {@link Fatal} ones do not.
 */
public sealed interface FetchOutcome permits FetchOutcome.Success, FetchOutcome.Retryable, FetchOutcome.Fatal {

    static FetchOutcome success(FetchedPage page) {
        return new Success(page);
    }

    static FetchOutcome retryable(FetchErrorType type, String reason) {
        return new Retryable(type, reason);
    }

    static FetchOutcome fatal(FetchErrorType type, String reason) {
        return new Fatal(type, reason);
    }

    record Success(FetchedPage page) implements FetchOutcome {
        public Success {
            Objects.requireNonNull(page, "page");
        }
    }

    record Retryable(FetchErrorType type, String reason) implements FetchOutcome {
        public Retryable {
            Objects.requireNonNull(type, "type");
        }

        public FetchException toException() {
            return new FetchException(type, reason);
        }
    }

    record Fatal(FetchErrorType type, String reason) implements FetchOutcome {
        public Fatal {
            Objects.requireNonNull(type, "type");
        }

        public FetchException toException() {
            return new FetchException(type, reason);
        }
    }
}
