package uk.gegc.antidote.shared.security;

import uk.gegc.antidote.shared.exception.InsufficientPrivilegeException;

/**
 * The "is this caller an administrator" predicate supplied by the authentication layer.
 */
public interface AdminAccessPolicy {

    boolean isAdmin();

    /**
     * Identifier of the current caller, recorded on admin-authored ledger entries and dispute decisions.
     */
    String currentActor();

    default void requireAdmin(String operation) {
        if (!isAdmin()) {
            throw new InsufficientPrivilegeException("Administrator privilege required for " + operation);
        }
    }
}
