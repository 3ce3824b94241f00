package dao.bmn.escrow.escrow;

import dao.bmn.escrow.chain.ChainNode;
import dao.bmn.escrow.chain.ManualChainClock;
import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.event.DstEscrowCreatedEvent;
import dao.bmn.escrow.event.EscrowEventDecoder;
import dao.bmn.escrow.event.EscrowLogEntry;
import dao.bmn.escrow.event.SrcEscrowCreatedEvent;
import dao.bmn.escrow.model.EscrowRole;
import dao.bmn.escrow.model.EscrowState;
import dao.bmn.escrow.model.FillExtraData;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.Order;
import dao.bmn.escrow.model.TimelockStage;
import dao.bmn.escrow.util.CryptoUtil;
import dao.bmn.escrow.util.ImmutablesDigest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static dao.bmn.escrow.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class EscrowFactoryTest {

    private ManualChainClock srcClock;
    private ManualChainClock dstClock;
    private ChainNode src;
    private ChainNode dst;
    private byte[] secret;
    private String hashlock;

    @BeforeEach
    void setUp() {
        srcClock = new ManualChainClock(T0);
        dstClock = new ManualChainClock(T0);
        src = ChainNode.create(1, "src", FACTORY, OWNER, ACCESS_TOKEN, FactorySettings.defaults(), srcClock);
        dst = ChainNode.create(8453, "dst", FACTORY, OWNER, ACCESS_TOKEN, FactorySettings.defaults(), dstClock);
        src.getRegistry().addResolver(RESOLVER);
        dst.getRegistry().addResolver(RESOLVER);

        src.getLedger().mint(TOKEN_A, MAKER, big(1000));
        src.getLedger().approve(TOKEN_A, MAKER, FACTORY, big(1000));
        src.getLedger().mint(NATIVE, RESOLVER, big(10));

        dst.getLedger().mint(TOKEN_B, RESOLVER, big(1000));
        dst.getLedger().approve(TOKEN_B, RESOLVER, FACTORY, big(1000));
        dst.getLedger().mint(NATIVE, RESOLVER, big(10));

        secret = secret(7);
        hashlock = CryptoUtil.hashlockOf(secret);
    }

    @Test
    @DisplayName("Fill deploys the source escrow at its predicted address and pulls both legs")
    void fillDeploysSourceEscrow() {
        SourceEscrow escrow = fill();

        assertEquals(src.getFactory().predictAddress(escrow.getImmutables(), EscrowRole.SOURCE), escrow.getAddress());
        assertEquals(escrow.getAddress(), src.getFactory().escrowFor(hashlock).orElseThrow());
        assertEquals(big(100), src.getLedger().balanceOf(TOKEN_A, escrow.getAddress()));
        assertEquals(big(1), src.getLedger().balanceOf(NATIVE, escrow.getAddress()));
        assertEquals(big(900), src.getLedger().balanceOf(TOKEN_A, MAKER));
        assertEquals(big(900), src.getLedger().allowance(TOKEN_A, MAKER, FACTORY));
        assertEquals(big(9), src.getLedger().balanceOf(NATIVE, RESOLVER));
    }

    @Test
    @DisplayName("Offsets are derived from the absolute instants of the fill")
    void fillDerivesOffsets() {
        Immutables im = fill().getImmutables();

        assertEquals(T0, im.getTimelocks().deployedAt());
        assertEquals(T0, im.getTimelocks().unlockInstant(TimelockStage.SRC_WITHDRAWAL));
        assertEquals(T0 + 60, im.getTimelocks().unlockInstant(TimelockStage.SRC_PUBLIC_WITHDRAWAL));
        assertEquals(T0 + 3600, im.getTimelocks().unlockInstant(TimelockStage.SRC_CANCELLATION));
        assertEquals(T0 + 3660, im.getTimelocks().unlockInstant(TimelockStage.SRC_PUBLIC_CANCELLATION));
        assertEquals(10, im.getTimelocks().offset(TimelockStage.DST_WITHDRAWAL));
        assertEquals(70, im.getTimelocks().offset(TimelockStage.DST_PUBLIC_WITHDRAWAL));
        assertEquals(3000, im.getTimelocks().offset(TimelockStage.DST_CANCELLATION));
    }

    @Test
    @DisplayName("Source creation entry carries the immutables and the destination complement")
    void fillAnnouncesComplement() {
        SourceEscrow escrow = fill();

        List<EscrowLogEntry> entries = src.getJournal().entriesAfter(0);
        assertEquals(1, entries.size());
        SrcEscrowCreatedEvent ev = EscrowEventDecoder.srcEscrowCreated(entries.get(0)).orElseThrow();

        assertEquals(escrow.getAddress(), ev.escrow());
        assertEquals(escrow.getDigestHex(), ImmutablesDigest.digestHex(ev.srcImmutables()));
        assertEquals(MAKER, ev.dstComplement().maker());
        assertEquals(big(200), ev.dstComplement().amount());
        assertEquals(TOKEN_B, ev.dstComplement().token());
        assertEquals(big(2), ev.dstComplement().safetyDeposit());
        assertEquals(8453L, ev.dstComplement().chainId());
    }

    @Test
    @DisplayName("Order receiver replaces the maker as destination recipient")
    void receiverOverridesMaker() {
        Order order = order(STRANGER);
        src.getFactory().onFillCompleted(order, RESOLVER, big(100), big(200), FillExtraDataCodec.encode(extra(T0 + 3600, T0 + 10)));

        SrcEscrowCreatedEvent ev = EscrowEventDecoder.srcEscrowCreated(src.getJournal().entriesAfter(0).get(0)).orElseThrow();
        assertEquals(STRANGER, ev.dstComplement().maker());
    }

    @Test
    @DisplayName("Destination escrow lands at the address predicted from its immutables")
    void destinationMatchesPrediction() {
        SourceEscrow srcEscrow = fill();
        Immutables dstIm = dstImmutables(srcEscrow);

        dstClock.set(T0 + 5);
        DestinationEscrow escrow = dst.getFactory().createDstEscrow(dstIm, T0 + 3600, RESOLVER);

        Immutables stamped = dstIm.withTimelocks(dstIm.getTimelocks().withDeploymentTimestamp(T0 + 5));
        assertEquals(dst.getFactory().predictAddress(stamped, EscrowRole.DESTINATION), escrow.getAddress());
        assertEquals(big(200), dst.getLedger().balanceOf(TOKEN_B, escrow.getAddress()));
        assertEquals(big(2), dst.getLedger().balanceOf(NATIVE, escrow.getAddress()));
        assertEquals(big(800), dst.getLedger().balanceOf(TOKEN_B, RESOLVER));

        DstEscrowCreatedEvent ev = EscrowEventDecoder.dstEscrowCreated(dst.getJournal().entriesAfter(0).get(0)).orElseThrow();
        assertEquals(escrow.getAddress(), ev.escrow());
        assertEquals(hashlock, ev.hashlock());
        assertEquals(RESOLVER, ev.taker());
    }

    @Test
    @DisplayName("Factories with the same address predict the same escrow address on every chain")
    void addressIsChainIndependent() {
        Immutables im = immutables(secret, MAKER, RESOLVER, TOKEN_A, 100, 1, standardTimelocks(T0));
        assertEquals(src.getFactory().predictAddress(im, EscrowRole.SOURCE), dst.getFactory().predictAddress(im, EscrowRole.SOURCE));
        assertNotEquals(src.getFactory().predictAddress(im, EscrowRole.SOURCE), src.getFactory().predictAddress(im, EscrowRole.DESTINATION));
    }

    @Test
    @DisplayName("A second escrow for the same hashlock is rejected and moves no value")
    void duplicateHashlockRejected() {
        Immutables dstIm = dstImmutables(fill());
        dst.getFactory().createDstEscrow(dstIm, T0 + 3600, RESOLVER);

        BigInteger tokens = dst.getLedger().balanceOf(TOKEN_B, RESOLVER);
        BigInteger nativeBalance = dst.getLedger().balanceOf(NATIVE, RESOLVER);
        Immutables different = dstIm.toBuilder().amount(big(1)).build();

        SwapException ex = assertThrows(SwapException.class,
                () -> dst.getFactory().createDstEscrow(different, T0 + 3600, RESOLVER));
        assertEquals(ErrorCode.ESCROW_ALREADY_EXISTS, ex.getCode());
        assertEquals(tokens, dst.getLedger().balanceOf(TOKEN_B, RESOLVER));
        assertEquals(nativeBalance, dst.getLedger().balanceOf(NATIVE, RESOLVER));
        assertEquals(1, dst.getRegistry().allEscrows().size());
    }

    @Test
    void duplicateFillRejected() {
        fill();
        SwapException ex = assertThrows(SwapException.class, this::fill);
        assertEquals(ErrorCode.ESCROW_ALREADY_EXISTS, ex.getCode());
        assertEquals(big(900), src.getLedger().balanceOf(TOKEN_A, MAKER));
    }

    @Test
    @DisplayName("Destination cancellation after the source cancellation is rejected")
    void destinationCancellationMustPrecedeSource() {
        Immutables dstIm = dstImmutables(fill());

        // 601s late: dst cancellation T0+601+3000 > T0+3600
        dstClock.set(T0 + 601);
        SwapException ex = assertThrows(SwapException.class,
                () -> dst.getFactory().createDstEscrow(dstIm, T0 + 3600, RESOLVER));
        assertEquals(ErrorCode.INVALID_CREATION_TIME, ex.getCode());
        assertTrue(dst.getRegistry().allEscrows().isEmpty());

        dstClock.set(T0 + 600);
        assertNotNull(dst.getFactory().createDstEscrow(dstIm, T0 + 3600, RESOLVER));
    }

    @Test
    @DisplayName("Native destination token is funded together with the deposit")
    void nativeDestinationToken() {
        Immutables im = immutables(secret, MAKER, RESOLVER, NATIVE, 5, 2, standardTimelocks(T0));
        DestinationEscrow escrow = dst.getFactory().createDstEscrow(im, T0 + 3600, RESOLVER);

        assertEquals(big(7), dst.getLedger().balanceOf(NATIVE, escrow.getAddress()));
        assertEquals(big(3), dst.getLedger().balanceOf(NATIVE, RESOLVER));
    }

    @Test
    @DisplayName("Fill with a past cancellation or withdrawal instant is rejected")
    void creationTimeChecks() {
        byte[] pastCancel = FillExtraDataCodec.encode(extra(T0, T0 + 10));
        SwapException ex = assertThrows(SwapException.class,
                () -> src.getFactory().onFillCompleted(order(null), RESOLVER, big(100), big(200), pastCancel));
        assertEquals(ErrorCode.INVALID_CREATION_TIME, ex.getCode());

        byte[] pastWithdrawal = FillExtraDataCodec.encode(extra(T0 + 3600, T0 - 1));
        ex = assertThrows(SwapException.class,
                () -> src.getFactory().onFillCompleted(order(null), RESOLVER, big(100), big(200), pastWithdrawal));
        assertEquals(ErrorCode.INVALID_CREATION_TIME, ex.getCode());

        assertEquals(big(1000), src.getLedger().balanceOf(TOKEN_A, MAKER));
    }

    @Test
    void malformedExtraDataRejected() {
        SwapException ex = assertThrows(SwapException.class,
                () -> src.getFactory().onFillCompleted(order(null), RESOLVER, big(100), big(200), new byte[64]));
        assertEquals(ErrorCode.INVALID_PAYLOAD, ex.getCode());
    }

    @Test
    @DisplayName("Negative filled taking amount is rejected before any value moves")
    void negativeTakingAmountMovesNothing() {
        byte[] extra = FillExtraDataCodec.encode(extra(T0 + 3600, T0 + 10));

        SwapException ex = assertThrows(SwapException.class,
                () -> src.getFactory().onFillCompleted(order(null), RESOLVER, big(100), big(-1), extra));
        assertEquals(ErrorCode.INVALID_PAYLOAD, ex.getCode());
        assertEquals(big(1000), src.getLedger().balanceOf(TOKEN_A, MAKER));
        assertEquals(big(1000), src.getLedger().allowance(TOKEN_A, MAKER, FACTORY));
        assertEquals(big(10), src.getLedger().balanceOf(NATIVE, RESOLVER));
        assertTrue(src.getFactory().escrowFor(hashlock).isEmpty());
        assertTrue(src.getRegistry().allEscrows().isEmpty());
        assertEquals(0, src.getJournal().latestSequence());

        assertNotNull(fill());
        assertEquals(1, src.getJournal().latestSequence());
    }

    @Test
    @DisplayName("Destination chain id beyond a signed 64-bit value is rejected with nothing moved")
    void oversizedDstChainIdMovesNothing() {
        byte[] extra = FillExtraDataCodec.encode(extra(T0 + 3600, T0 + 10));
        // word 1 := 2^63
        Arrays.fill(extra, 32, 64, (byte) 0);
        extra[56] = (byte) 0x80;

        SwapException ex = assertThrows(SwapException.class,
                () -> src.getFactory().onFillCompleted(order(null), RESOLVER, big(100), big(200), extra));
        assertEquals(ErrorCode.INVALID_PAYLOAD, ex.getCode());
        assertEquals(big(1000), src.getLedger().balanceOf(TOKEN_A, MAKER));
        assertTrue(src.getRegistry().allEscrows().isEmpty());
        assertEquals(0, src.getJournal().latestSequence());
    }

    @Test
    @DisplayName("Out-of-range destination amounts are rejected as malformed, not crashed on")
    void outOfRangeDestinationAmounts() {
        Immutables dstIm = dstImmutables(fill());
        BigInteger tooLarge = BigInteger.ONE.shiftLeft(256);

        SwapException ex = assertThrows(SwapException.class, () -> dst.getFactory()
                .createDstEscrow(dstIm.toBuilder().amount(big(-5)).build(), T0 + 3600, RESOLVER));
        assertEquals(ErrorCode.INVALID_PAYLOAD, ex.getCode());

        ex = assertThrows(SwapException.class, () -> dst.getFactory()
                .createDstEscrow(dstIm.toBuilder().safetyDeposit(tooLarge).build(), T0 + 3600, RESOLVER));
        assertEquals(ErrorCode.INVALID_PAYLOAD, ex.getCode());

        ex = assertThrows(SwapException.class, () -> dst.getFactory()
                .predictAddress(dstIm.toBuilder().amount(tooLarge).build(), EscrowRole.DESTINATION));
        assertEquals(ErrorCode.INVALID_PAYLOAD, ex.getCode());

        assertEquals(big(1000), dst.getLedger().balanceOf(TOKEN_B, RESOLVER));
        assertEquals(big(10), dst.getLedger().balanceOf(NATIVE, RESOLVER));
        assertTrue(dst.getRegistry().allEscrows().isEmpty());
        assertEquals(0, dst.getJournal().latestSequence());
    }

    @Test
    @DisplayName("Mutating the caller's parameters array after creation does not break the escrow")
    void parametersAreCopiedOnCreation() {
        byte[] parameters = {1, 2, 3};
        Immutables dstIm = dstImmutables(fill()).toBuilder().parameters(parameters).build();
        DestinationEscrow escrow = dst.getFactory().createDstEscrow(dstIm, T0 + 3600, RESOLVER);
        String digest = escrow.getDigestHex();

        parameters[0] = 9;
        escrow.getImmutables().getParameters()[1] = 9;

        Immutables held = escrow.getImmutables();
        assertArrayEquals(new byte[]{1, 2, 3}, held.getParameters());
        assertEquals(digest, ImmutablesDigest.digestHex(held));

        dstClock.set(T0 + 10);
        escrow.withdraw(RESOLVER, secret, held);
        assertEquals(EscrowState.WITHDRAWN, escrow.getState());
        assertEquals(big(200), dst.getLedger().balanceOf(TOKEN_B, MAKER));
    }

    @Test
    @DisplayName("Missing maker allowance aborts the fill with nothing moved")
    void missingAllowanceMovesNothing() {
        src.getLedger().approve(TOKEN_A, MAKER, FACTORY, big(99));

        SwapException ex = assertThrows(SwapException.class, this::fill);
        assertEquals(ErrorCode.INSUFFICIENT_ALLOWANCE, ex.getCode());
        assertEquals(big(10), src.getLedger().balanceOf(NATIVE, RESOLVER));
        assertEquals(big(1000), src.getLedger().balanceOf(TOKEN_A, MAKER));
        assertTrue(src.getFactory().escrowFor(hashlock).isEmpty());
        assertEquals(0, src.getJournal().latestSequence());
    }

    @Test
    @DisplayName("Pause blocks creation only; deployed escrows still cancel")
    void pauseBlocksCreationOnly() {
        SourceEscrow escrow = fill();
        src.getFactory().setPaused(OWNER, true);

        secret = secret(8);
        hashlock = CryptoUtil.hashlockOf(secret);
        SwapException ex = assertThrows(SwapException.class, this::fill);
        assertEquals(ErrorCode.FACTORY_PAUSED, ex.getCode());

        srcClock.set(T0 + 3600);
        escrow.cancel(RESOLVER, escrow.getImmutables());
        assertEquals(EscrowState.CANCELLED, escrow.getState());

        srcClock.set(T0);
        src.getFactory().setPaused(OWNER, false);
        assertNotNull(fill());
    }

    @Test
    void onlyOwnerAdministers() {
        assertEquals(ErrorCode.NOT_OWNER,
                assertThrows(SwapException.class, () -> src.getFactory().setPaused(RESOLVER, true)).getCode());
        assertEquals(ErrorCode.NOT_OWNER,
                assertThrows(SwapException.class, () -> src.getFactory().addResolver(MAKER, MAKER)).getCode());
        assertEquals(ErrorCode.NOT_OWNER,
                assertThrows(SwapException.class, () -> src.getFactory().setWhitelistBypassed(null, true)).getCode());
        assertFalse(src.getRegistry().isPaused());

        src.getFactory().transferOwnership(OWNER, STRANGER);
        assertEquals(ErrorCode.NOT_OWNER,
                assertThrows(SwapException.class, () -> src.getFactory().setPaused(OWNER, true)).getCode());
        src.getFactory().setPaused(STRANGER, true);
        assertTrue(src.getRegistry().isPaused());
    }

    @Test
    @DisplayName("Non-whitelisted resolvers cannot create escrows unless the whitelist is bypassed")
    void whitelistAndBypass() {
        src.getFactory().removeResolver(OWNER, RESOLVER);
        SwapException ex = assertThrows(SwapException.class, this::fill);
        assertEquals(ErrorCode.NOT_WHITELISTED_RESOLVER, ex.getCode());

        src.getFactory().setWhitelistBypassed(OWNER, true);
        assertNotNull(fill());
    }

    private SourceEscrow fill() {
        return src.getFactory().onFillCompleted(order(null), RESOLVER, big(100), big(200),
                FillExtraDataCodec.encode(extra(T0 + 3600, T0 + 10)));
    }

    private Order order(String receiver) {
        return new Order(ORDER_HASH, BigInteger.ONE, MAKER, receiver, TOKEN_A, TOKEN_B, big(100), big(200));
    }

    private FillExtraData extra(long srcCancellation, long dstWithdrawal) {
        return new FillExtraData(hashlock, 8453, TOKEN_B,
                FillExtraData.packDeposits(big(2), big(1)),
                FillExtraData.packTimelocks(srcCancellation, dstWithdrawal));
    }

    private Immutables dstImmutables(SourceEscrow srcEscrow) {
        SrcEscrowCreatedEvent ev = EscrowEventDecoder.srcEscrowCreated(
                src.getJournal().entriesFor(FACTORY).get(0)).orElseThrow();
        assertEquals(srcEscrow.getAddress(), ev.escrow());
        return ev.dstComplement().toDestinationImmutables(ev.srcImmutables());
    }
}
