package dao.bmn.escrow.auth;

import dao.bmn.escrow.ledger.TokenLedger;
import dao.bmn.escrow.util.CryptoUtil;

import java.math.BigInteger;

/**
 * Callers holding any positive balance of the access token may act.
 */
public class TokenHolderPolicy implements AuthorizationPolicy {

    private final TokenLedger ledger;
    private final String accessToken;

    public TokenHolderPolicy(TokenLedger ledger, String accessToken) {
        this.ledger = ledger;
        this.accessToken = CryptoUtil.normalizeAddress(accessToken);
    }

    @Override
    public boolean permits(AccessRequest request) {
        return ledger.balanceOf(accessToken, request.caller()).compareTo(BigInteger.ZERO) > 0;
    }
}
