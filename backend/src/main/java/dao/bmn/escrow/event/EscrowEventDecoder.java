package dao.bmn.escrow.event;

import dao.bmn.escrow.model.DstImmutablesComplement;
import dao.bmn.escrow.model.Immutables;
import dao.bmn.escrow.model.Timelocks;
import dao.bmn.escrow.util.CryptoUtil;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes journal entries back into typed events. Entries with a different topic0 are skipped,
 * so callers can feed a whole journal through any of these methods.
 */
public final class EscrowEventDecoder {
    private EscrowEventDecoder() {}

    public static Optional<SrcEscrowCreatedEvent> srcEscrowCreated(EscrowLogEntry entry) {
        if (!matches(entry, EscrowEvents.SRC_ESCROW_CREATED_TOPIC, 3)) return Optional.empty();

        List<Type<?>> decoded = decodeWeb3Abi(
                entry.dataHex(),
                new TypeReference<Bytes32>() {},
                new TypeReference<Address>() {},
                new TypeReference<Address>() {},
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<DynamicBytes>() {},
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<DynamicBytes>() {}
        );
        requireDecodedSize(decoded, 14);

        Immutables src = Immutables.builder()
                .orderHash(CryptoUtil.toHex0x(((Bytes32) decoded.get(0)).getValue()))
                .hashlock(normalizeHex32(entry.topics().get(2)))
                .maker(((Address) decoded.get(1)).getValue())
                .taker(((Address) decoded.get(2)).getValue())
                .token(((Address) decoded.get(3)).getValue())
                .amount(((Uint256) decoded.get(4)).getValue())
                .safetyDeposit(((Uint256) decoded.get(5)).getValue())
                .timelocks(Timelocks.fromPacked(((Uint256) decoded.get(6)).getValue()))
                .parameters(((DynamicBytes) decoded.get(7)).getValue())
                .build();

        DstImmutablesComplement complement = new DstImmutablesComplement(
                ((Address) decoded.get(8)).getValue(),
                ((Uint256) decoded.get(9)).getValue(),
                ((Address) decoded.get(10)).getValue(),
                ((Uint256) decoded.get(11)).getValue(),
                ((Uint256) decoded.get(12)).getValue().longValueExact(),
                ((DynamicBytes) decoded.get(13)).getValue()
        );

        return Optional.of(new SrcEscrowCreatedEvent(entry.sequence(), topicAddress(entry.topics().get(1)), src, complement));
    }

    public static Optional<DstEscrowCreatedEvent> dstEscrowCreated(EscrowLogEntry entry) {
        if (!matches(entry, EscrowEvents.DST_ESCROW_CREATED_TOPIC, 3)) return Optional.empty();

        List<Type<?>> decoded = decodeWeb3Abi(
                entry.dataHex(),
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {}
        );
        requireDecodedSize(decoded, 2);

        return Optional.of(new DstEscrowCreatedEvent(
                entry.sequence(),
                topicAddress(entry.topics().get(1)),
                normalizeHex32(entry.topics().get(2)),
                ((Address) decoded.get(0)).getValue(),
                Timelocks.fromPacked(((Uint256) decoded.get(1)).getValue())
        ));
    }

    /**
     * The hashlock is recomputed from the revealed secret, so a reader can match it against any
     * chain without knowing which escrow emitted it.
     */
    public static Optional<EscrowWithdrawalEvent> escrowWithdrawal(EscrowLogEntry entry) {
        if (!matches(entry, EscrowEvents.ESCROW_WITHDRAWAL_TOPIC, 1)) return Optional.empty();

        List<Type<?>> decoded = decodeWeb3Abi(entry.dataHex(), new TypeReference<Bytes32>() {});
        requireDecodedSize(decoded, 1);

        byte[] secret = ((Bytes32) decoded.get(0)).getValue();
        return Optional.of(new EscrowWithdrawalEvent(
                entry.sequence(),
                entry.chainId(),
                entry.emitter(),
                CryptoUtil.toHex0x(secret),
                CryptoUtil.hashlockOf(secret)
        ));
    }

    public static boolean isEscrowCancelled(EscrowLogEntry entry) {
        return matches(entry, EscrowEvents.ESCROW_CANCELLED_TOPIC, 1);
    }

    public static Optional<FundsRescuedEvent> fundsRescued(EscrowLogEntry entry) {
        if (!matches(entry, EscrowEvents.FUNDS_RESCUED_TOPIC, 1)) return Optional.empty();

        List<Type<?>> decoded = decodeWeb3Abi(
                entry.dataHex(),
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {}
        );
        requireDecodedSize(decoded, 2);

        return Optional.of(new FundsRescuedEvent(
                entry.sequence(),
                entry.emitter(),
                ((Address) decoded.get(0)).getValue(),
                ((Uint256) decoded.get(1)).getValue()
        ));
    }

    private static boolean matches(EscrowLogEntry entry, String topic0, int minTopics) {
        if (entry == null || entry.topics().size() < minTopics) return false;
        return normalizeHex32(entry.topic0()).equalsIgnoreCase(normalizeHex32(topic0));
    }

    private static String topicAddress(String topic) {
        String c = CryptoUtil.cleanHex(normalizeHex32(topic));
        return CryptoUtil.normalizeAddress(c.substring(c.length() - 40));
    }

    private static String normalizeHex32(String hex) {
        String c = CryptoUtil.cleanHex(hex).toLowerCase(Locale.ROOT);
        int n = 32 * 2;
        // Ensure fixed width: take least-significant bytes, left-pad with 0s
        if (c.length() < n) {
            c = "0".repeat(n - c.length()) + c;
        } else if (c.length() > n) {
            c = c.substring(c.length() - n);
        }
        return "0x" + c;
    }

    private static void requireDecodedSize(List<?> decoded, int expected) {
        if (decoded.size() != expected) {
            throw new IllegalStateException("Unexpected decoded outputs=" + decoded.size() + ", expected=" + expected);
        }
    }

    private static List<Type<?>> decodeWeb3Abi(String dataHex, TypeReference<?>... outputs) {
        String hex = Numeric.prependHexPrefix(dataHex);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<TypeReference<Type>> typed = (List) Arrays.asList(outputs);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<Type<?>> decoded = (List) FunctionReturnDecoder.decode(hex, typed);
        return decoded;
    }
}
