package dao.bmn.escrow.event;

import dao.bmn.escrow.model.DstImmutablesComplement;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.Timelocks;
import dao.bmn.escrow.util.CryptoUtil;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Event signatures and the encoders the escrow and factory use to write journal entries.
 *
 * Indexed values go to topics (escrow address, hashlock); everything else is ABI-encoded data.
 */
public final class EscrowEvents {
    private EscrowEvents() {}

    public static final String SRC_ESCROW_CREATED =
            "SrcEscrowCreated(address,bytes32,bytes32,address,address,address,uint256,uint256,uint256,bytes,address,uint256,address,uint256,uint256,bytes)";
    public static final String DST_ESCROW_CREATED = "DstEscrowCreated(address,bytes32,address,uint256)";
    public static final String ESCROW_WITHDRAWAL = "EscrowWithdrawal(bytes32)";
    public static final String ESCROW_CANCELLED = "EscrowCancelled()";
    public static final String FUNDS_RESCUED = "FundsRescued(address,uint256)";

    // topic0 = keccak256(eventSignature)
    public static final String SRC_ESCROW_CREATED_TOPIC = Hash.sha3String(SRC_ESCROW_CREATED);
    public static final String DST_ESCROW_CREATED_TOPIC = Hash.sha3String(DST_ESCROW_CREATED);
    public static final String ESCROW_WITHDRAWAL_TOPIC = Hash.sha3String(ESCROW_WITHDRAWAL);
    public static final String ESCROW_CANCELLED_TOPIC = Hash.sha3String(ESCROW_CANCELLED);
    public static final String FUNDS_RESCUED_TOPIC = Hash.sha3String(FUNDS_RESCUED);

    /**
     * Encodes the source creation entry. Throws {@code IllegalArgumentException} or web3j's
     * {@code UnsupportedOperationException} when a field does not fit its ABI type.
     */
    public static PendingLogEntry srcEscrowCreated(String factory, String escrow,
                                                   Immutables src, DstImmutablesComplement dst) {
        String data = encode(
                new Bytes32(CryptoUtil.bytes32(src.getOrderHash())),
                new Address(CryptoUtil.normalizeAddress(src.getMaker())),
                new Address(CryptoUtil.normalizeAddress(src.getTaker())),
                new Address(CryptoUtil.normalizeAddress(src.getToken())),
                new Uint256(src.getAmount()),
                new Uint256(src.getSafetyDeposit()),
                new Uint256(src.getTimelocks().packed()),
                new DynamicBytes(src.getParameters()),
                new Address(CryptoUtil.normalizeAddress(dst.maker())),
                new Uint256(dst.amount()),
                new Address(CryptoUtil.normalizeAddress(dst.token())),
                new Uint256(dst.safetyDeposit()),
                new Uint256(BigInteger.valueOf(dst.chainId())),
                new DynamicBytes(dst.parameters() == null ? new byte[0] : dst.parameters())
        );
        return new PendingLogEntry(CryptoUtil.normalizeAddress(factory),
                List.of(SRC_ESCROW_CREATED_TOPIC, addressTopic(escrow), CryptoUtil.normalizeBytes32(src.getHashlock())),
                data);
    }

    public static PendingLogEntry dstEscrowCreated(String factory, String escrow,
                                                   String hashlock, String taker, Timelocks timelocks) {
        String data = encode(
                new Address(CryptoUtil.normalizeAddress(taker)),
                new Uint256(timelocks.packed())
        );
        return new PendingLogEntry(CryptoUtil.normalizeAddress(factory),
                List.of(DST_ESCROW_CREATED_TOPIC, addressTopic(escrow), CryptoUtil.normalizeBytes32(hashlock)),
                data);
    }

    public static EscrowLogEntry escrowWithdrawal(EscrowJournal journal, String escrow, byte[] secret) {
        return journal.append(escrow, List.of(ESCROW_WITHDRAWAL_TOPIC), encode(new Bytes32(secret)));
    }

    public static EscrowLogEntry escrowCancelled(EscrowJournal journal, String escrow) {
        return journal.append(escrow, List.of(ESCROW_CANCELLED_TOPIC), "0x");
    }

    public static EscrowLogEntry fundsRescued(EscrowJournal journal, String escrow, String token, BigInteger amount) {
        return journal.append(escrow, List.of(FUNDS_RESCUED_TOPIC),
                encode(new Address(CryptoUtil.normalizeAddress(token)), new Uint256(amount)));
    }

    public static String addressTopic(String address) {
        String clean = CryptoUtil.cleanHex(CryptoUtil.normalizeAddress(address));
        return "0x" + "0".repeat(24) + clean;
    }

    private static String encode(Type... values) {
        return "0x" + FunctionEncoder.encodeConstructor(Arrays.<Type>asList(values));
    }
}
