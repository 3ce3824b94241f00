package dao.bmn.escrow.ledger;

import java.math.BigInteger;

/**
 * One leg of a settlement. When {@code spender} is set the leg is pulled from {@code from} against
 * the allowance granted to {@code spender}; otherwise {@code from} moves its own funds.
 */
public record Transfer(String token, String from, String to, BigInteger amount, String spender) {

    public static Transfer of(String token, String from, String to, BigInteger amount) {
        return new Transfer(token, from, to, amount, null);
    }

    public static Transfer pulled(String spender, String token, String from, String to, BigInteger amount) {
        return new Transfer(token, from, to, amount, spender);
    }

    public boolean isPulled() {
        return spender != null;
    }
}
