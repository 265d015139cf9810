package com.musicapi;

import com.musicapi.auth.Scope;
import com.musicapi.model.ItemKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Base type for every failure raised by the client.
 *
 * <p>Local precondition failures ({@link MissingScopeException},
 * {@link TooManyIdentifiersException}, {@link UnsupportedDirectionException})
 * are always raised before any request is sent. {@link RemoteRequestFailedException}
 * is passed through traversal and bulk operations unchanged.
 */
public abstract class MusicApiException extends RuntimeException {

    protected MusicApiException(String message) {
        super(message);
    }

    protected MusicApiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the active credential lacks scopes an operation requires.
     */
    public static class MissingScopeException extends MusicApiException {
        private final Set<Scope> missingScopes;

        public MissingScopeException(Set<Scope> missingScopes) {
            super("Missing required scopes: " + missingScopes.stream()
                    .map(Scope::id)
                    .collect(Collectors.joining(", ")));
            this.missingScopes = missingScopes.isEmpty()
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(EnumSet.copyOf(missingScopes));
        }

        public Set<Scope> getMissingScopes() {
            return missingScopes;
        }
    }

    /**
     * Thrown when more identifiers are passed than one request accepts
     * and bulk requests are turned off.
     */
    public static class TooManyIdentifiersException extends MusicApiException {
        private final int maxPerRequest;
        private final int requestedCount;

        public TooManyIdentifiersException(int maxPerRequest, int requestedCount) {
            super("Too many ids (" + requestedCount + ") provided, only " + maxPerRequest
                    + " allowed. Enable bulk requests to split them across several calls");
            this.maxPerRequest = maxPerRequest;
            this.requestedCount = requestedCount;
        }

        public int getMaxPerRequest() {
            return maxPerRequest;
        }

        public int getRequestedCount() {
            return requestedCount;
        }
    }

    /**
     * Thrown when a page is asked to move in a direction its paging style forbids.
     */
    public static class UnsupportedDirectionException extends MusicApiException {
        public UnsupportedDirectionException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when no decoder is registered for an item kind. This means the
     * client and the service disagree on the response schema and is not retryable.
     */
    public static class UnrecognizedItemKindException extends MusicApiException {
        private final ItemKind itemKind;

        public UnrecognizedItemKindException(ItemKind itemKind, String pagingStyle) {
            super("No " + pagingStyle + " decoder registered for item kind " + itemKind);
            this.itemKind = itemKind;
        }

        public ItemKind getItemKind() {
            return itemKind;
        }
    }

    /**
     * Thrown when the remote service rejects a request or cannot be reached.
     */
    public static class RemoteRequestFailedException extends MusicApiException {
        private final Integer statusCode;

        public RemoteRequestFailedException(int statusCode, String message) {
            super(message);
            this.statusCode = statusCode;
        }

        public RemoteRequestFailedException(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = null;
        }

        /**
         * Returns the HTTP status code, or empty when the request never got a response.
         */
        public OptionalInt getStatusCode() {
            return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
        }
    }

    /**
     * Thrown when a response body cannot be bound to the expected model.
     */
    public static class ResponseParseException extends MusicApiException {
        public ResponseParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
