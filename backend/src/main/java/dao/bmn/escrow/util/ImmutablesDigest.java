package dao.bmn.escrow.util;

import dao.bmn.escrow.model.Immutables;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.List;

/**
 * keccak256 over the ABI encoding of the full immutables tuple:
 * (bytes32 orderHash, bytes32 hashlock, address maker, address taker, address token,
 *  uint256 amount, uint256 safetyDeposit, uint256 timelocks, bytes parameters)
 *
 * The trailing {@code bytes} is encoded as offset + length + padded data, so two parameter blobs
 * that differ only in trailing bytes still hash differently.
 */
public final class ImmutablesDigest {
    private ImmutablesDigest() {}

    public static byte[] digest(Immutables im) {
        return CryptoUtil.keccak256(encode(im));
    }

    public static String digestHex(Immutables im) {
        return CryptoUtil.toHex0x(digest(im));
    }

    public static byte[] encode(Immutables im) {
        if (im == null) {
            throw new IllegalArgumentException("Immutables are null");
        }
        if (im.getTimelocks() == null || im.getAmount() == null || im.getSafetyDeposit() == null) {
            throw new IllegalArgumentException("Immutables are incomplete: " + im);
        }
        if (!CryptoUtil.isUint256(im.getAmount()) || !CryptoUtil.isUint256(im.getSafetyDeposit())) {
            throw new IllegalArgumentException("amount and safety deposit must be uint256: " + im);
        }
        byte[] parameters = im.getParameters();

        List<Type> fields = Arrays.<Type>asList(
                new Bytes32(CryptoUtil.bytes32(im.getOrderHash())),
                new Bytes32(CryptoUtil.bytes32(im.getHashlock())),
                new Address(CryptoUtil.normalizeAddress(im.getMaker())),
                new Address(CryptoUtil.normalizeAddress(im.getTaker())),
                new Address(CryptoUtil.normalizeAddress(im.getToken())),
                new Uint256(im.getAmount()),
                new Uint256(im.getSafetyDeposit()),
                new Uint256(im.getTimelocks().packed()),
                new DynamicBytes(parameters)
        );
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(fields));
    }
}
