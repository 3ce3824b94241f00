package dao.bmn.escrow.ledger;

import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryTokenLedger implements TokenLedger {

    // key: token|holder
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();

    // key: token|owner|spender
    private final Map<String, BigInteger> allowances = new ConcurrentHashMap<>();

    private final long chainId;

    public InMemoryTokenLedger(long chainId) {
        this.chainId = chainId;
    }

    @Override
    public BigInteger balanceOf(String token, String holder) {
        return balances.getOrDefault(balanceKey(token, holder), BigInteger.ZERO);
    }

    @Override
    public BigInteger allowance(String token, String owner, String spender) {
        return allowances.getOrDefault(allowanceKey(token, owner, spender), BigInteger.ZERO);
    }

    @Override
    public synchronized void approve(String token, String owner, String spender, BigInteger amount) {
        requireNonNegative(amount);
        allowances.put(allowanceKey(token, owner, spender), amount);
    }

    @Override
    public synchronized void mint(String token, String to, BigInteger amount) {
        requireNonNegative(amount);
        balances.merge(balanceKey(token, to), amount, BigInteger::add);
        log.debug("chain {}: minted {} of {} to {}", chainId, amount, token, to);
    }

    @Override
    public synchronized void settle(List<Transfer> transfers) {
        // validate aggregate debits first so a failing leg leaves every balance untouched
        Map<String, BigInteger> debits = new HashMap<>();
        Map<String, BigInteger> pulls = new HashMap<>();
        for (Transfer t : transfers) {
            requireNonNegative(t.amount());
            debits.merge(balanceKey(t.token(), t.from()), t.amount(), BigInteger::add);
            if (t.isPulled()) {
                pulls.merge(allowanceKey(t.token(), t.from(), t.spender()), t.amount(), BigInteger::add);
            }
        }
        for (Map.Entry<String, BigInteger> e : debits.entrySet()) {
            BigInteger available = balances.getOrDefault(e.getKey(), BigInteger.ZERO);
            if (available.compareTo(e.getValue()) < 0) {
                throw new SwapException(ErrorCode.INSUFFICIENT_BALANCE,
                        e.getKey() + " has " + available + ", needs " + e.getValue());
            }
        }
        for (Map.Entry<String, BigInteger> e : pulls.entrySet()) {
            BigInteger granted = allowances.getOrDefault(e.getKey(), BigInteger.ZERO);
            if (granted.compareTo(e.getValue()) < 0) {
                throw new SwapException(ErrorCode.INSUFFICIENT_ALLOWANCE,
                        e.getKey() + " allows " + granted + ", needs " + e.getValue());
            }
        }

        for (Transfer t : transfers) {
            if (t.amount().signum() == 0) continue;
            balances.merge(balanceKey(t.token(), t.from()), t.amount().negate(), BigInteger::add);
            balances.merge(balanceKey(t.token(), t.to()), t.amount(), BigInteger::add);
            if (t.isPulled()) {
                allowances.merge(allowanceKey(t.token(), t.from(), t.spender()), t.amount().negate(), BigInteger::add);
            }
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative, got " + amount);
        }
    }

    private static String balanceKey(String token, String holder) {
        return CryptoUtil.normalizeAddress(token) + "|" + CryptoUtil.normalizeAddress(holder);
    }

    private static String allowanceKey(String token, String owner, String spender) {
        return balanceKey(token, owner) + "|" + CryptoUtil.normalizeAddress(spender);
    }
}
