package dao.bmn.escrow.auth;

/**
 * Decides whether a caller holds the capability for a public escrow action.
 */
public interface AuthorizationPolicy {

    boolean permits(AccessRequest request);

    static AuthorizationPolicy anyOf(AuthorizationPolicy... policies) {
        return new AnyOfPolicy(policies);
    }
}
