package dao.bmn.escrow.model;

import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import dao.bmn.escrow.util.CryptoUtil;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

@Data
public class ImmutablesRequest {

    @NotBlank
    private String orderHash;       // bytes32 hex

    @NotBlank
    private String hashlock;        // bytes32 hex

    @NotBlank
    private String maker;

    @NotBlank
    private String taker;

    @NotBlank
    private String token;

    @NotBlank
    private String amount;          // string decimal

    @NotBlank
    private String safetyDeposit;   // string decimal, native

    @NotBlank
    private String timelocks;       // packed uint256, 0x-hex or decimal

    private String parameters;      // hex, optional

    public Immutables toImmutables() {
        try {
            return Immutables.builder()
                    .orderHash(CryptoUtil.normalizeBytes32(orderHash))
                    .hashlock(CryptoUtil.normalizeBytes32(hashlock))
                    .maker(CryptoUtil.normalizeAddress(maker))
                    .taker(CryptoUtil.normalizeAddress(taker))
                    .token(CryptoUtil.normalizeAddress(token))
                    .amount(parseUint256("amount", amount))
                    .safetyDeposit(parseUint256("safetyDeposit", safetyDeposit))
                    .timelocks(Timelocks.fromPacked(parseUint(timelocks)))
                    .parameters(parameters == null || parameters.isBlank()
                            ? new byte[0]
                            : Numeric.hexStringToByteArray(parameters.trim()))
                    .build();
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new SwapException(ErrorCode.INVALID_PAYLOAD, e.getMessage());
        }
    }

    private static BigInteger parseUint256(String field, String value) {
        BigInteger parsed = new BigInteger(value.trim());
        if (!CryptoUtil.isUint256(parsed)) {
            throw new IllegalArgumentException(field + " is not a uint256: " + value);
        }
        return parsed;
    }

    private static BigInteger parseUint(String value) {
        String v = value.trim();
        return v.startsWith("0x") || v.startsWith("0X") ? Numeric.toBigInt(v) : new BigInteger(v);
    }
}
