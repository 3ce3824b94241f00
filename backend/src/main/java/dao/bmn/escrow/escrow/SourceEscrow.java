package dao.bmn.escrow.escrow;

import dao.bmn.escrow.auth.PublicAction;
import dao.bmn.escrow.model.EscrowRole;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.TimelockStage;
import dao.bmn.escrow.util.CryptoUtil;

/**
 * Escrow on the maker's chain. Locks the maker's tokens; the taker claims them with the secret,
 * otherwise they go back to the maker.
 *
 * withdraw / withdrawTo:  taker, [SrcWithdrawal, SrcCancellation)
 * publicWithdraw:         access holder, [SrcPublicWithdrawal, SrcCancellation)
 * cancel:                 taker, [SrcCancellation, ...)
 * publicCancel:           access holder, [SrcPublicCancellation, ...)
 */
public class SourceEscrow extends BaseEscrow {

    public SourceEscrow(String address, String factory, Immutables immutables, long rescueDelay, EscrowContext context) {
        super(address, factory, immutables, rescueDelay, context);
    }

    @Override
    public EscrowRole getRole() {
        return EscrowRole.SOURCE;
    }

    /**
     * Same as {@link #withdraw} but sends the locked amount to {@code target}.
     */
    public synchronized void withdrawTo(String caller, byte[] secret, String target, Immutables im) {
        requireValidImmutables(im);
        requireActive();
        requireTaker(caller, im);
        requireWindow(withdrawalStage(), cancellationStage());
        requireValidSecret(secret, im);
        payOut(caller, secret, im, CryptoUtil.normalizeAddress(target));
    }

    public void publicCancel(String caller, Immutables im) {
        publicCancel(caller, im, null);
    }

    public synchronized void publicCancel(String caller, Immutables im, byte[] endorsement) {
        requireValidImmutables(im);
        requireActive();
        requireAuthorized(caller, PublicAction.PUBLIC_CANCEL, endorsement);
        requireAfter(TimelockStage.SRC_PUBLIC_CANCELLATION);
        refund(caller, im);
    }

    @Override
    protected TimelockStage withdrawalStage() {
        return TimelockStage.SRC_WITHDRAWAL;
    }

    @Override
    protected TimelockStage publicWithdrawalStage() {
        return TimelockStage.SRC_PUBLIC_WITHDRAWAL;
    }

    @Override
    protected TimelockStage cancellationStage() {
        return TimelockStage.SRC_CANCELLATION;
    }

    @Override
    protected String withdrawalRecipient(Immutables im) {
        return im.getTaker();
    }

    @Override
    protected String refundRecipient(Immutables im) {
        return im.getMaker();
    }
}
