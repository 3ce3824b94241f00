package dao.bmn.escrow.ledger;

import java.math.BigInteger;
import java.util.List;

/**
 * Value-transfer primitives of one chain. The native asset is the zero address.
 */
public interface TokenLedger {

    BigInteger balanceOf(String token, String holder);

    BigInteger allowance(String token, String owner, String spender);

    void approve(String token, String owner, String spender, BigInteger amount);

    /**
     * Credit without a debit. Used to seed balances on a local chain.
     */
    void mint(String token, String to, BigInteger amount);

    /**
     * Apply every leg or none. Throws {@code SwapException} with INSUFFICIENT_BALANCE or
     * INSUFFICIENT_ALLOWANCE when any leg cannot be covered; balances are then untouched.
     */
    void settle(List<Transfer> transfers);

    default void transfer(String token, String from, String to, BigInteger amount) {
        settle(List.of(Transfer.of(token, from, to, amount)));
    }
}
