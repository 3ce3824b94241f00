package dao.bmn.escrow.escrow;

import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.event.EscrowEvents;
import dao.bmn.escrow.event.PendingLogEntry;
import dao.bmn.escrow.ledger.Transfer;
import dao.bmn.escrow.model.DstImmutablesComplement;
import dao.bmn.escrow.model.EscrowRole;
import dao.bmn.escrow.model.FillExtraData;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.Order;
import dao.bmn.escrow.model.TimelockStage;
import dao.bmn.escrow.model.Timelocks;
import dao.bmn.escrow.repository.FactoryRegistry;
import dao.bmn.escrow.util.CryptoUtil;
import dao.bmn.escrow.util.DeterministicAddress;
import dao.bmn.escrow.util.ImmutablesDigest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Deploys escrows at content-addressed locations on one chain.
 *
 * address = DeterministicAddress.of(factory, digest(immutables), implementation(role))
 *
 * The formula uses nothing chain-specific, so a factory with the same address on another chain
 * predicts the same location for the same immutables. Creation is keyed by hashlock: the first
 * successful creation wins, later ones are rejected whoever sends them. Pausing stops creation
 * only; deployed escrows keep working.
 */
@Slf4j
public class EscrowFactory {

    static final String SRC_IMPLEMENTATION_LABEL = "EscrowSrc";
    static final String DST_IMPLEMENTATION_LABEL = "EscrowDst";

    @Getter
    private final String address;
    @Getter
    private final EscrowContext context;
    @Getter
    private final FactoryRegistry registry;
    @Getter
    private final FactorySettings settings;

    private final String srcImplementation;
    private final String dstImplementation;

    public EscrowFactory(String address, EscrowContext context, FactoryRegistry registry, FactorySettings settings) {
        this.address = CryptoUtil.normalizeAddress(address);
        this.context = context;
        this.registry = registry;
        this.settings = settings;
        this.srcImplementation = DeterministicAddress.implementation(this.address, SRC_IMPLEMENTATION_LABEL);
        this.dstImplementation = DeterministicAddress.implementation(this.address, DST_IMPLEMENTATION_LABEL);
        log.info("EscrowFactory initialized: chain={}, factory={}, srcImpl={}, dstImpl={}, owner={}",
                context.chainId(), this.address, srcImplementation, dstImplementation, registry.getOwner());
    }

    public long getChainId() {
        return context.chainId();
    }

    public String implementationOf(EscrowRole role) {
        return role == EscrowRole.SOURCE ? srcImplementation : dstImplementation;
    }

    /**
     * Address the escrow for these immutables occupies (or will occupy). Pure: nothing is deployed.
     */
    public String predictAddress(Immutables immutables, EscrowRole role) {
        try {
            return DeterministicAddress.of(address, ImmutablesDigest.digest(immutables), implementationOf(role));
        } catch (IllegalArgumentException e) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, e.getMessage());
        }
    }

    /**
     * Order-protocol callback after a fill. Deploys the source escrow, pulls the maker's tokens
     * (against the allowance granted to this factory) and the resolver's native safety deposit, and
     * announces the destination complement.
     */
    public synchronized SourceEscrow onFillCompleted(Order order,
                                                     String resolvedTaker,
                                                     BigInteger filledMakingAmount,
                                                     BigInteger filledTakingAmount,
                                                     byte[] extraParameters) {
        requireNotPaused();
        requireResolver(resolvedTaker);
        requireUint256("filled making amount", filledMakingAmount);
        requireUint256("filled taking amount", filledTakingAmount);

        FillExtraData extra = FillExtraDataCodec.decode(extraParameters);
        long now = context.clock().now();
        Timelocks timelocks = deriveTimelocks(extra, now);

        Immutables src = Immutables.builder()
                .orderHash(CryptoUtil.normalizeBytes32(order.orderHash()))
                .hashlock(CryptoUtil.normalizeBytes32(extra.hashlock()))
                .maker(CryptoUtil.normalizeAddress(order.maker()))
                .taker(CryptoUtil.normalizeAddress(resolvedTaker))
                .token(CryptoUtil.normalizeAddress(order.makerAsset()))
                .amount(filledMakingAmount)
                .safetyDeposit(extra.srcSafetyDeposit())
                .timelocks(timelocks)
                .build();

        DstImmutablesComplement complement = new DstImmutablesComplement(
                CryptoUtil.normalizeAddress(order.effectiveReceiver()),
                filledTakingAmount,
                CryptoUtil.normalizeAddress(extra.dstToken()),
                extra.dstSafetyDeposit(),
                extra.dstChainId(),
                new byte[0]
        );

        requireUnusedHashlock(src.getHashlock());
        String escrowAddress = predictAddress(src, EscrowRole.SOURCE);
        PendingLogEntry created = encodeOrReject(
                () -> EscrowEvents.srcEscrowCreated(address, escrowAddress, src, complement));

        List<Transfer> funding = new ArrayList<>();
        funding.add(Transfer.pulled(address, src.getToken(), src.getMaker(), escrowAddress, src.getAmount()));
        funding.add(Transfer.of(CryptoUtil.NATIVE_TOKEN, src.getTaker(), escrowAddress, src.getSafetyDeposit()));
        context.ledger().settle(funding);

        SourceEscrow escrow = new SourceEscrow(escrowAddress, address, src, settings.srcRescueDelay(), context);
        registry.register(src.getHashlock(), escrow);
        created.appendTo(context.journal());

        log.info("chain {}: source escrow {} created: hashlock={}, maker={}, taker={}, amount={}, dstChain={}",
                context.chainId(), escrowAddress, src.getHashlock(), src.getMaker(), src.getTaker(),
                src.getAmount(), extra.dstChainId());
        return escrow;
    }

    /**
     * Resolver entry point on the destination chain. The deployment timestamp is stamped here; the
     * destination cancellation must not come after the source cancellation, otherwise the maker
     * could refund on the source chain while the resolver is still locked on this one.
     */
    public synchronized DestinationEscrow createDstEscrow(Immutables dstImmutables, long srcCancellationTimestamp, String caller) {
        requireNotPaused();
        requireResolver(caller);

        long now = context.clock().now();
        Immutables dst = normalize(dstImmutables)
                .withTimelocks(dstImmutables.getTimelocks().withDeploymentTimestamp(now));

        if (!dst.getTimelocks().isConventionallyOrdered()) {
            throw new SwapException(ErrorCode.INVALID_CREATION_TIME, "stages out of order: " + dst.getTimelocks());
        }
        long dstCancellation = dst.getTimelocks().unlockInstant(TimelockStage.DST_CANCELLATION);
        if (dstCancellation > srcCancellationTimestamp) {
            throw new SwapException(ErrorCode.INVALID_CREATION_TIME,
                    "dst cancellation " + dstCancellation + " after src cancellation " + srcCancellationTimestamp);
        }

        requireUnusedHashlock(dst.getHashlock());
        String escrowAddress = predictAddress(dst, EscrowRole.DESTINATION);
        PendingLogEntry created = encodeOrReject(() -> EscrowEvents.dstEscrowCreated(
                address, escrowAddress, dst.getHashlock(), dst.getTaker(), dst.getTimelocks()));

        List<Transfer> funding = new ArrayList<>();
        if (CryptoUtil.isNative(dst.getToken())) {
            funding.add(Transfer.of(CryptoUtil.NATIVE_TOKEN, caller, escrowAddress, dst.getAmount().add(dst.getSafetyDeposit())));
        } else {
            funding.add(Transfer.of(CryptoUtil.NATIVE_TOKEN, caller, escrowAddress, dst.getSafetyDeposit()));
            funding.add(Transfer.pulled(address, dst.getToken(), caller, escrowAddress, dst.getAmount()));
        }
        context.ledger().settle(funding);

        DestinationEscrow escrow = new DestinationEscrow(escrowAddress, address, dst, settings.dstRescueDelay(), context);
        registry.register(dst.getHashlock(), escrow);
        created.appendTo(context.journal());

        log.info("chain {}: destination escrow {} created: hashlock={}, maker={}, taker={}, amount={}",
                context.chainId(), escrowAddress, dst.getHashlock(), dst.getMaker(), dst.getTaker(), dst.getAmount());
        return escrow;
    }

    public Optional<String> escrowFor(String hashlock) {
        return registry.addressFor(hashlock);
    }

    public Optional<BaseEscrow> escrowAt(String escrowAddress) {
        return registry.escrowAt(escrowAddress);
    }

    public BaseEscrow requireEscrow(String escrowAddress) {
        return escrowAt(escrowAddress)
                .orElseThrow(() -> new SwapException(ErrorCode.ESCROW_NOT_FOUND, escrowAddress));
    }

    public void setPaused(String caller, boolean paused) {
        requireOwner(caller);
        registry.setPaused(paused);
        log.info("chain {}: factory paused={}", context.chainId(), paused);
    }

    public void addResolver(String caller, String resolver) {
        requireOwner(caller);
        registry.addResolver(resolver);
        log.info("chain {}: resolver {} whitelisted", context.chainId(), resolver);
    }

    public void removeResolver(String caller, String resolver) {
        requireOwner(caller);
        registry.removeResolver(resolver);
        log.info("chain {}: resolver {} removed from whitelist", context.chainId(), resolver);
    }

    public void setWhitelistBypassed(String caller, boolean bypassed) {
        requireOwner(caller);
        registry.setWhitelistBypassed(bypassed);
        log.info("chain {}: whitelist bypass={}", context.chainId(), bypassed);
    }

    public void transferOwnership(String caller, String newOwner) {
        requireOwner(caller);
        registry.setOwner(newOwner);
        log.info("chain {}: ownership transferred to {}", context.chainId(), newOwner);
    }

    /**
     * Offsets relative to {@code now} from the two absolute instants of the fill.
     */
    Timelocks deriveTimelocks(FillExtraData extra, long now) {
        long srcCancellation = extra.srcCancellationTimestamp();
        long dstWithdrawal = extra.dstWithdrawalTimestamp();
        if (srcCancellation <= now) {
            throw new SwapException(ErrorCode.INVALID_CREATION_TIME, "src cancellation " + srcCancellation + " not after " + now);
        }
        if (dstWithdrawal < now) {
            throw new SwapException(ErrorCode.INVALID_CREATION_TIME, "dst withdrawal " + dstWithdrawal + " before " + now);
        }

        long srcCancellationOffset = srcCancellation - now;
        long dstWithdrawalOffset = dstWithdrawal - now;
        long dstCancellationOffset = settings.alignDstCancellationToSrc()
                ? srcCancellationOffset
                : Math.max(0L, srcCancellationOffset - settings.dstCancellationLead());

        long[] offsets = new long[TimelockStage.values().length];
        offsets[TimelockStage.SRC_WITHDRAWAL.ordinal()] = settings.srcWithdrawalOffset();
        offsets[TimelockStage.SRC_PUBLIC_WITHDRAWAL.ordinal()] = settings.srcWithdrawalOffset() + settings.publicWithdrawalGap();
        offsets[TimelockStage.SRC_CANCELLATION.ordinal()] = srcCancellationOffset;
        offsets[TimelockStage.SRC_PUBLIC_CANCELLATION.ordinal()] = srcCancellationOffset + settings.publicCancellationGap();
        offsets[TimelockStage.DST_WITHDRAWAL.ordinal()] = dstWithdrawalOffset;
        offsets[TimelockStage.DST_PUBLIC_WITHDRAWAL.ordinal()] = dstWithdrawalOffset + settings.publicWithdrawalGap();
        offsets[TimelockStage.DST_CANCELLATION.ordinal()] = dstCancellationOffset;

        for (long offset : offsets) {
            if (offset > 0xFFFF_FFFFL) {
                throw new SwapException(ErrorCode.INVALID_CREATION_TIME, "offset does not fit 32 bits: " + offset);
            }
        }
        Timelocks timelocks = Timelocks.pack(offsets).withDeploymentTimestamp(now);
        if (!timelocks.isConventionallyOrdered()) {
            throw new SwapException(ErrorCode.INVALID_CREATION_TIME, "stages out of order: " + timelocks);
        }
        return timelocks;
    }

    private static Immutables normalize(Immutables im) {
        if (im == null || im.getTimelocks() == null || im.getAmount() == null || im.getSafetyDeposit() == null) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, "incomplete immutables");
        }
        requireUint256("amount", im.getAmount());
        requireUint256("safety deposit", im.getSafetyDeposit());
        try {
            return im.toBuilder()
                    .orderHash(CryptoUtil.normalizeBytes32(im.getOrderHash()))
                    .hashlock(CryptoUtil.normalizeBytes32(im.getHashlock()))
                    .maker(CryptoUtil.normalizeAddress(im.getMaker()))
                    .taker(CryptoUtil.normalizeAddress(im.getTaker()))
                    .token(CryptoUtil.normalizeAddress(im.getToken()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, e.getMessage());
        }
    }

    private static void requireUint256(String field, BigInteger value) {
        if (!CryptoUtil.isUint256(value)) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, field + " is not a uint256: " + value);
        }
    }

    // Everything that can fail in encoding happens here, before any value moves.
    private static PendingLogEntry encodeOrReject(Supplier<PendingLogEntry> encoder) {
        try {
            return encoder.get();
        } catch (IllegalArgumentException | UnsupportedOperationException e) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, e.getMessage());
        }
    }

    private void requireUnusedHashlock(String hashlock) {
        Optional<String> existing = registry.addressFor(hashlock);
        if (existing.isPresent()) {
            throw new SwapException(ErrorCode.ESCROW_ALREADY_EXISTS, hashlock + " -> " + existing.get());
        }
    }

    private void requireNotPaused() {
        if (registry.isPaused()) {
            throw new SwapException(ErrorCode.FACTORY_PAUSED);
        }
    }

    private void requireResolver(String resolver) {
        if (registry.isWhitelistBypassed()) return;
        if (resolver == null || !registry.isWhitelisted(resolver)) {
            throw new SwapException(ErrorCode.NOT_WHITELISTED_RESOLVER, String.valueOf(resolver));
        }
    }

    private void requireOwner(String caller) {
        if (caller == null || !CryptoUtil.normalizeAddress(caller).equals(registry.getOwner())) {
            throw new SwapException(ErrorCode.NOT_OWNER, String.valueOf(caller));
        }
    }
}
