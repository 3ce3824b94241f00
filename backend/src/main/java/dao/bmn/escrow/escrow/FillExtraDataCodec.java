package dao.bmn.escrow.escrow;

import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.model.FillExtraData;
import dao.bmn.escrow.util.CryptoUtil;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Extra parameters attached to an order fill. Fixed layout of five 32-byte ABI words:
 *
 * 0: bytes32 hashlock
 * 1: uint256 dstChainId
 * 2: address dstToken
 * 3: uint256 deposits   = (dstSafetyDeposit << 128) | srcSafetyDeposit
 * 4: uint256 timelocks  = (srcCancellationTimestamp << 128) | dstWithdrawalTimestamp
 */
public final class FillExtraDataCodec {
    private FillExtraDataCodec() {}

    public static final int ENCODED_LENGTH = 5 * 32;

    private static final BigInteger CHAIN_ID_LIMIT = BigInteger.valueOf(Long.MAX_VALUE);
    private static final BigInteger TIMESTAMP_LIMIT = BigInteger.ONE.shiftLeft(32);
    private static final BigInteger LOW_128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    public static byte[] encode(FillExtraData data) {
        String hex = FunctionEncoder.encodeConstructor(Arrays.<Type>asList(
                new Bytes32(CryptoUtil.bytes32(data.hashlock())),
                new Uint256(BigInteger.valueOf(data.dstChainId())),
                new Address(CryptoUtil.normalizeAddress(data.dstToken())),
                new Uint256(data.deposits()),
                new Uint256(data.timelocks())
        ));
        return Numeric.hexStringToByteArray(hex);
    }

    public static FillExtraData decode(byte[] extra) {
        if (extra == null || extra.length != ENCODED_LENGTH) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD,
                    "extra parameters must be " + ENCODED_LENGTH + " bytes, got " + (extra == null ? 0 : extra.length));
        }

        List<TypeReference<?>> outputs = List.of(
                new TypeReference<Bytes32>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {}
        );
        @SuppressWarnings({"rawtypes", "unchecked"})
        List<Type> decoded = FunctionReturnDecoder.decode(Numeric.toHexString(extra), (List) outputs);
        if (decoded.size() != 5) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, "decoded " + decoded.size() + " words, expected 5");
        }

        BigInteger chainId = ((Uint256) decoded.get(1)).getValue();
        BigInteger timelocks = ((Uint256) decoded.get(4)).getValue();
        if (chainId.compareTo(CHAIN_ID_LIMIT) > 0) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, "dstChainId out of range: " + chainId);
        }
        // unix seconds, same width as the deployment timestamp inside Timelocks
        if (timelocks.shiftRight(128).compareTo(TIMESTAMP_LIMIT) >= 0 || timelocks.and(LOW_128).compareTo(TIMESTAMP_LIMIT) >= 0) {
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, "timestamps out of range");
        }

        return new FillExtraData(
                CryptoUtil.toHex0x(((Bytes32) decoded.get(0)).getValue()),
                chainId.longValueExact(),
                ((Address) decoded.get(2)).getValue(),
                ((Uint256) decoded.get(3)).getValue(),
                timelocks
        );
    }
}
