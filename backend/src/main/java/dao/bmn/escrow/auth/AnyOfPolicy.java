package dao.bmn.escrow.auth;

import java.util.List;

public class AnyOfPolicy implements AuthorizationPolicy {

    private final List<AuthorizationPolicy> policies;

    public AnyOfPolicy(AuthorizationPolicy... policies) {
        this.policies = List.of(policies);
    }

    @Override
    public boolean permits(AccessRequest request) {
        for (AuthorizationPolicy p : policies) {
            if (p.permits(request)) return true;
        }
        return false;
    }
}
