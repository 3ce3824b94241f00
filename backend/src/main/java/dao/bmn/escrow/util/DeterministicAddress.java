package dao.bmn.escrow.util;

import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * CREATE2-style address derivation for EIP-1167 minimal proxies.
 *
 * address = keccak256(0xff ++ deployer ++ salt ++ keccak256(proxyInitCode(implementation)))[12:]
 *
 * Pure function of its inputs: any two processes with the same deployer, salt and implementation
 * arrive at the same address without talking to each other.
 */
public final class DeterministicAddress {
    private DeterministicAddress() {}

    private static final byte[] PROXY_PREFIX = Numeric.hexStringToByteArray("3d602d80600a3d3981f3363d3d373d3d3d363d73");
    private static final byte[] PROXY_SUFFIX = Numeric.hexStringToByteArray("5af43d82803e903d91602b57fd5bf3");

    public static String of(String deployer, byte[] salt, String implementation) {
        if (salt == null || salt.length != 32) {
            throw new IllegalArgumentException("Salt must be 32 bytes");
        }
        return create2(deployer, salt, CryptoUtil.keccak256(proxyInitCode(implementation)));
    }

    /**
     * Plain CREATE2 for an already hashed init code.
     */
    public static String create2(String deployer, byte[] salt, byte[] initCodeHash) {
        if (salt == null || salt.length != 32 || initCodeHash == null || initCodeHash.length != 32) {
            throw new IllegalArgumentException("Salt and init code hash must be 32 bytes");
        }
        byte[] preimage = CryptoUtil.concat(
                new byte[]{(byte) 0xff},
                CryptoUtil.addressBytes(deployer),
                salt,
                initCodeHash
        );
        return lastTwentyBytes(CryptoUtil.keccak256(preimage));
    }

    public static byte[] proxyInitCode(String implementation) {
        return CryptoUtil.concat(PROXY_PREFIX, CryptoUtil.addressBytes(implementation), PROXY_SUFFIX);
    }

    /**
     * Implementation address for a labelled escrow template owned by a factory:
     * keccak256(factory ++ label)[12:].
     */
    public static String implementation(String factory, String label) {
        byte[] preimage = CryptoUtil.concat(
                CryptoUtil.addressBytes(factory),
                label.getBytes(StandardCharsets.UTF_8)
        );
        return lastTwentyBytes(CryptoUtil.keccak256(preimage));
    }

    private static String lastTwentyBytes(byte[] hash) {
        return CryptoUtil.toHex0x(Arrays.copyOfRange(hash, hash.length - 20, hash.length));
    }
}
