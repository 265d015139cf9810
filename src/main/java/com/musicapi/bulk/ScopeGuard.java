package com.musicapi.bulk;

import com.musicapi.MusicApiException.MissingScopeException;
import com.musicapi.auth.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Checks the scopes of the active credential before a request is issued.
 * The check is purely local.
 */
public class ScopeGuard {

    private static final Logger log = LoggerFactory.getLogger(ScopeGuard.class);

    private final Supplier<Set<Scope>> grantedScopes;

    /**
     * @param grantedScopes supplies the scopes of the credential in use at call time
     */
    public ScopeGuard(Supplier<Set<Scope>> grantedScopes) {
        this.grantedScopes = Objects.requireNonNull(grantedScopes, "grantedScopes");
    }

    /**
     * Requires every one of {@code required}.
     *
     * @throws MissingScopeException naming each required scope that is not granted
     */
    public void requireScopes(Scope... required) {
        requireScopes(Set.copyOf(Arrays.asList(required)), false);
    }

    /**
     * Requires all of {@code required}, or with {@code anyOf} at least one of them.
     *
     * @param required the scopes the operation needs
     * @param anyOf whether a single granted scope out of {@code required} is enough
     * @throws MissingScopeException naming the missing scopes; with {@code anyOf} that is all of them
     */
    public void requireScopes(Set<Scope> required, boolean anyOf) {
        if (required.isEmpty()) {
            return;
        }
        Set<Scope> granted = grantedScopes.get();
        Set<Scope> missing = EnumSet.copyOf(required);
        if (granted != null) {
            missing.removeAll(granted);
        }

        boolean satisfied = anyOf ? missing.size() < required.size() : missing.isEmpty();
        if (!satisfied) {
            log.debug("Rejecting call: required {} (anyOf={}), granted {}", required, anyOf, granted);
            throw new MissingScopeException(missing);
        }
    }
}
