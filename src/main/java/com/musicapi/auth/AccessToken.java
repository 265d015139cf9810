package com.musicapi.auth;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Bearer token and the scopes granted with it.
 * Obtaining and refreshing tokens happens outside this library.
 */
public record AccessToken(String value, Set<Scope> grantedScopes) {

    public AccessToken {
        Objects.requireNonNull(value, "value");
        grantedScopes = grantedScopes == null || grantedScopes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(grantedScopes));
    }

    /**
     * Creates a token from the raw {@code scope} field of a token response.
     */
    public static AccessToken of(String value, String scopeField) {
        return new AccessToken(value, Scope.parse(scopeField));
    }

    public static AccessToken of(String value, Scope... scopes) {
        return new AccessToken(value, scopes.length == 0 ? Set.of() : EnumSet.of(scopes[0], scopes));
    }

    @Override
    public String toString() {
        return "AccessToken[grantedScopes=" + grantedScopes + "]";
    }
}
