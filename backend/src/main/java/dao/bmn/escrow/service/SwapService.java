package dao.bmn.escrow.service;

import dao.bmn.escrow.chain.ChainNode;
import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.escrow.BaseEscrow;
import dao.bmn.escrow.escrow.DestinationEscrow;
import dao.bmn.escrow.escrow.FillExtraDataCodec;
import dao.bmn.escrow.escrow.SourceEscrow;
import dao.bmn.escrow.event.EscrowEventDecoder;
import dao.bmn.escrow.event.EscrowLogEntry;
import dao.bmn.escrow.event.EscrowWithdrawalEvent;
import dao.bmn.escrow.event.SecretRevealReader;
import dao.bmn.escrow.event.SrcEscrowCreatedEvent;
import dao.bmn.escrow.model.EscrowRole;
import dao.bmn.escrow.model.FillExtraData;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.Order;
import dao.bmn.escrow.model.TimelockStage;
import dao.bmn.escrow.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Swap flows across the hosted chains: fill on the source chain, mirror on the destination chain,
 * then withdraw or cancel either leg.
 * <p>
 * Escrow calls need the immutables; they are read back from the escrow that was deployed, the way
 * an off-chain client would rebuild them from the creation log.
 */
@Slf4j
@Service
public class SwapService {

    private final ChainNetwork network;
    private final SecretRevealReader revealReader;

    public SwapService(ChainNetwork network, SecretRevealReader revealReader) {
        this.network = network;
        this.revealReader = revealReader;
    }

    /**
     * Order-protocol fill on {@code srcChainId}. The extra data is ABI-encoded exactly as the
     * order protocol would hand it to the factory.
     */
    public SourceEscrow fillOrder(long srcChainId,
                                  Order order,
                                  String resolver,
                                  BigInteger filledMakingAmount,
                                  BigInteger filledTakingAmount,
                                  FillExtraData extra) {
        ChainNode node = network.node(srcChainId);
        byte[] payload = FillExtraDataCodec.encode(extra);
        SourceEscrow escrow = node.getFactory().onFillCompleted(order, resolver, filledMakingAmount, filledTakingAmount, payload);
        log.info("Order {} filled on chain {} by {}: escrow={}", order.orderHash(), srcChainId, resolver, escrow.getAddress());
        return escrow;
    }

    /**
     * Source creation entry for {@code hashlock} on {@code srcChainId}.
     */
    public Optional<SrcEscrowCreatedEvent> findSourceCreation(long srcChainId, String hashlock) {
        String wanted = CryptoUtil.normalizeBytes32(hashlock);
        for (EscrowLogEntry entry : network.node(srcChainId).getJournal().entriesAfter(0)) {
            Optional<SrcEscrowCreatedEvent> ev = EscrowEventDecoder.srcEscrowCreated(entry);
            if (ev.isPresent() && CryptoUtil.normalizeBytes32(ev.get().srcImmutables().getHashlock()).equals(wanted)) {
                return ev;
            }
        }
        return Optional.empty();
    }

    /**
     * Resolver mirror of a source escrow on the chain named by its complement.
     */
    public DestinationEscrow createDestination(SrcEscrowCreatedEvent created, String resolver) {
        Immutables src = created.srcImmutables();
        Immutables dst = created.dstComplement().toDestinationImmutables(src);
        long srcCancellation = src.getTimelocks().unlockInstant(TimelockStage.SRC_CANCELLATION);
        return createDestination(created.dstComplement().chainId(), dst, srcCancellation, resolver);
    }

    public DestinationEscrow createDestination(long dstChainId, Immutables dstImmutables, long srcCancellationTimestamp, String resolver) {
        ChainNode node = network.node(dstChainId);
        DestinationEscrow escrow = node.getFactory().createDstEscrow(dstImmutables, srcCancellationTimestamp, resolver);
        log.info("Destination escrow {} created on chain {} by {}", escrow.getAddress(), dstChainId, resolver);
        return escrow;
    }

    public String predictAddress(long chainId, Immutables immutables, EscrowRole role) {
        return network.node(chainId).getFactory().predictAddress(immutables, role);
    }

    public BaseEscrow escrowByHashlock(long chainId, String hashlock) {
        ChainNode node = network.node(chainId);
        String address = node.getFactory().escrowFor(hashlock)
                .orElseThrow(() -> new SwapException(ErrorCode.ESCROW_NOT_FOUND, hashlock));
        return node.getFactory().requireEscrow(address);
    }

    public BaseEscrow escrowAt(long chainId, String escrowAddress) {
        return network.node(chainId).getFactory().requireEscrow(escrowAddress);
    }

    public void withdraw(long chainId, String escrowAddress, String caller, byte[] secret) {
        BaseEscrow escrow = escrowAt(chainId, escrowAddress);
        escrow.withdraw(caller, secret, escrow.getImmutables());
    }

    /**
     * Resolver side of the exchange: waits (up to the configured reveal timeout) for the secret of
     * this escrow's hashlock to show up on any chain, then withdraws with it.
     */
    public EscrowWithdrawalEvent withdrawWithRevealedSecret(long chainId, String escrowAddress, String caller) {
        BaseEscrow escrow = escrowAt(chainId, escrowAddress);
        EscrowWithdrawalEvent reveal = revealReader.readWithTimeout(escrow.getHashlock())
                .orElseThrow(() -> new SwapException(ErrorCode.INVALID_SECRET,
                        "no secret revealed for " + escrow.getHashlock()));
        log.info("Using secret revealed on chain {} by {} to withdraw {} on chain {}",
                reveal.chainId(), reveal.escrow(), escrowAddress, chainId);
        escrow.withdraw(caller, Numeric.hexStringToByteArray(reveal.secretHex()), escrow.getImmutables());
        return reveal;
    }

    public void withdrawTo(long chainId, String escrowAddress, String caller, byte[] secret, String target) {
        BaseEscrow escrow = escrowAt(chainId, escrowAddress);
        if (!(escrow instanceof SourceEscrow)) {
            throw new SwapException(ErrorCode.INVALID_STATE, "withdrawTo is only available on source escrows");
        }
        ((SourceEscrow) escrow).withdrawTo(caller, secret, target, escrow.getImmutables());
    }

    public void publicWithdraw(long chainId, String escrowAddress, String caller, byte[] secret, byte[] endorsement) {
        BaseEscrow escrow = escrowAt(chainId, escrowAddress);
        escrow.publicWithdraw(caller, secret, escrow.getImmutables(), endorsement);
    }

    public void cancel(long chainId, String escrowAddress, String caller) {
        BaseEscrow escrow = escrowAt(chainId, escrowAddress);
        escrow.cancel(caller, escrow.getImmutables());
    }

    public void publicCancel(long chainId, String escrowAddress, String caller, byte[] endorsement) {
        BaseEscrow escrow = escrowAt(chainId, escrowAddress);
        if (!(escrow instanceof SourceEscrow)) {
            throw new SwapException(ErrorCode.INVALID_STATE, "publicCancel is only available on source escrows");
        }
        ((SourceEscrow) escrow).publicCancel(caller, escrow.getImmutables(), endorsement);
    }

    public void rescueFunds(long chainId, String escrowAddress, String caller, String token, BigInteger amount) {
        BaseEscrow escrow = escrowAt(chainId, escrowAddress);
        escrow.rescueFunds(caller, token, amount, escrow.getImmutables());
    }
}
