package dao.bmn.escrow.escrow;

import dao.bmn.escrow.auth.AccessRequest;
import dao.bmn.escrow.auth.PublicAction;
import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.event.EscrowEvents;
import dao.bmn.escrow.ledger.Transfer;
import dao.bmn.escrow.model.EscrowRole;
import dao.bmn.escrow.model.EscrowState;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.TimelockStage;
import dao.bmn.escrow.util.CryptoUtil;
import dao.bmn.escrow.util.ImmutablesDigest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.util.List;

/**
 * One leg of a swap. Holds its value on the chain ledger under its own address and moves it only
 * through the transitions below; every call re-supplies the immutables, which must hash to the
 * digest captured at deployment.
 *
 * Checks run in a fixed order: immutables, state, caller, time, secret. A rejected call leaves
 * balances, state and journal untouched. Transitions are serialized per escrow.
 */
@Slf4j
public abstract class BaseEscrow {

    @Getter
    private final String address;
    @Getter
    private final String factory;
    @Getter
    private final Immutables immutables;
    @Getter
    private final long rescueDelay;

    private final byte[] capturedDigest;
    protected final EscrowContext context;

    private volatile EscrowState state = EscrowState.ACTIVE;

    protected BaseEscrow(String address, String factory, Immutables immutables, long rescueDelay, EscrowContext context) {
        this.address = CryptoUtil.normalizeAddress(address);
        this.factory = CryptoUtil.normalizeAddress(factory);
        this.immutables = immutables;
        this.rescueDelay = rescueDelay;
        this.capturedDigest = ImmutablesDigest.digest(immutables);
        this.context = context;
    }

    public abstract EscrowRole getRole();

    protected abstract TimelockStage withdrawalStage();

    protected abstract TimelockStage publicWithdrawalStage();

    protected abstract TimelockStage cancellationStage();

    /** Who receives the locked amount on a successful withdrawal. */
    protected abstract String withdrawalRecipient(Immutables im);

    /** Who gets the locked amount back on cancellation. */
    protected abstract String refundRecipient(Immutables im);

    public EscrowState getState() {
        return state;
    }

    public String getHashlock() {
        return CryptoUtil.normalizeBytes32(immutables.getHashlock());
    }

    public String getDigestHex() {
        return CryptoUtil.toHex0x(capturedDigest);
    }

    public long unlockInstant(TimelockStage stage) {
        return immutables.getTimelocks().unlockInstant(stage);
    }

    public long rescueInstant() {
        return immutables.getTimelocks().rescueInstant(rescueDelay);
    }

    /**
     * Taker-only withdrawal in [withdrawal, cancellation).
     */
    public synchronized void withdraw(String caller, byte[] secret, Immutables im) {
        requireValidImmutables(im);
        requireActive();
        requireTaker(caller, im);
        requireWindow(withdrawalStage(), cancellationStage());
        requireValidSecret(secret, im);
        payOut(caller, secret, im, withdrawalRecipient(im));
    }

    public void publicWithdraw(String caller, byte[] secret, Immutables im) {
        publicWithdraw(caller, secret, im, null);
    }

    /**
     * Withdrawal by any authorized keeper in [public withdrawal, cancellation). The payout target is
     * the same as for {@link #withdraw}; the safety deposit goes to the keeper.
     */
    public synchronized void publicWithdraw(String caller, byte[] secret, Immutables im, byte[] endorsement) {
        requireValidImmutables(im);
        requireActive();
        requireAuthorized(caller, PublicAction.PUBLIC_WITHDRAW, endorsement);
        requireWindow(publicWithdrawalStage(), cancellationStage());
        requireValidSecret(secret, im);
        payOut(caller, secret, im, withdrawalRecipient(im));
    }

    /**
     * Taker-only cancellation from the cancellation instant on.
     */
    public synchronized void cancel(String caller, Immutables im) {
        requireValidImmutables(im);
        requireActive();
        requireTaker(caller, im);
        requireAfter(cancellationStage());
        refund(caller, im);
    }

    /**
     * Taker-only sweep of any balance after deployedAt + rescueDelay. Does not change the state and
     * may be repeated.
     */
    public synchronized void rescueFunds(String caller, String token, BigInteger amount, Immutables im) {
        requireValidImmutables(im);
        requireTaker(caller, im);
        long now = context.clock().now();
        if (now < rescueInstant()) {
            throw new SwapException(ErrorCode.INVALID_TIME, "rescue opens at " + rescueInstant() + ", now " + now);
        }
        if (!CryptoUtil.isUint256(amount)) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, "rescue amount is not a uint256: " + amount);
        }
        context.ledger().settle(List.of(Transfer.of(token, address, caller, amount)));
        EscrowEvents.fundsRescued(context.journal(), address, token, amount);
        log.info("chain {}: escrow {} rescued {} of {} to {}", context.chainId(), address, amount, token, caller);
    }

    protected void payOut(String caller, byte[] secret, Immutables im, String recipient) {
        context.ledger().settle(List.of(
                Transfer.of(im.getToken(), address, recipient, im.getAmount()),
                Transfer.of(CryptoUtil.NATIVE_TOKEN, address, caller, im.getSafetyDeposit())
        ));
        state = EscrowState.WITHDRAWN;
        EscrowEvents.escrowWithdrawal(context.journal(), address, secret);
        log.info("chain {}: {} escrow {} withdrawn: {} -> {}, deposit -> {}",
                context.chainId(), getRole(), address, im.getAmount(), recipient, caller);
    }

    protected void refund(String caller, Immutables im) {
        String recipient = refundRecipient(im);
        context.ledger().settle(List.of(
                Transfer.of(im.getToken(), address, recipient, im.getAmount()),
                Transfer.of(CryptoUtil.NATIVE_TOKEN, address, caller, im.getSafetyDeposit())
        ));
        state = EscrowState.CANCELLED;
        EscrowEvents.escrowCancelled(context.journal(), address);
        log.info("chain {}: {} escrow {} cancelled: {} -> {}, deposit -> {}",
                context.chainId(), getRole(), address, im.getAmount(), recipient, caller);
    }

    protected void requireValidImmutables(Immutables im) {
        byte[] supplied;
        try {
            supplied = ImmutablesDigest.digest(im);
        } catch (IllegalArgumentException | UnsupportedOperationException e) {
            throw new SwapException(ErrorCode.INVALID_IMMUTABLES, e.getMessage());
        }
        if (!MessageDigest.isEqual(supplied, capturedDigest)) {
            throw new SwapException(ErrorCode.INVALID_IMMUTABLES, "digest " + CryptoUtil.toHex0x(supplied));
        }
    }

    protected void requireActive() {
        if (state.isTerminal()) {
            throw new SwapException(ErrorCode.INVALID_STATE, address + " is " + state);
        }
    }

    protected void requireTaker(String caller, Immutables im) {
        if (caller == null || !CryptoUtil.normalizeAddress(caller).equals(CryptoUtil.normalizeAddress(im.getTaker()))) {
            throw new SwapException(ErrorCode.INVALID_CALLER, String.valueOf(caller));
        }
    }

    protected void requireAuthorized(String caller, PublicAction action, byte[] endorsement) {
        if (caller == null) {
            throw new SwapException(ErrorCode.INVALID_CALLER, "no caller");
        }
        AccessRequest request = new AccessRequest(context.chainId(), address, CryptoUtil.normalizeAddress(caller),
                action, capturedDigest.clone(), endorsement);
        if (!context.accessPolicy().permits(request)) {
            throw new SwapException(ErrorCode.INVALID_CALLER, caller + " lacks access for " + action);
        }
    }

    protected void requireAfter(TimelockStage start) {
        long now = context.clock().now();
        if (now < unlockInstant(start)) {
            throw new SwapException(ErrorCode.INVALID_TIME, start + " opens at " + unlockInstant(start) + ", now " + now);
        }
    }

    protected void requireWindow(TimelockStage start, TimelockStage end) {
        requireAfter(start);
        long now = context.clock().now();
        if (now >= unlockInstant(end)) {
            throw new SwapException(ErrorCode.INVALID_TIME, "window closed at " + unlockInstant(end) + ", now " + now);
        }
    }

    protected void requireValidSecret(byte[] secret, Immutables im) {
        if (secret == null || secret.length != 32) {
            throw new SwapException(ErrorCode.INVALID_SECRET, "secret must be 32 bytes");
        }
        byte[] expected = CryptoUtil.bytes32(im.getHashlock());
        if (!MessageDigest.isEqual(CryptoUtil.keccak256(secret), expected)) {
            throw new SwapException(ErrorCode.INVALID_SECRET);
        }
    }
}
