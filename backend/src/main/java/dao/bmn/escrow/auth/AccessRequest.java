package dao.bmn.escrow.auth;

/**
 * What an escrow hands to its {@link AuthorizationPolicy} before a public action.
 * {@code endorsement} is a 65-byte r||s||v signature or null.
 */
public record AccessRequest(
        long chainId,
        String escrow,
        String caller,
        PublicAction action,
        byte[] immutablesDigest,
        byte[] endorsement
) {

    public boolean hasEndorsement() {
        return endorsement != null && endorsement.length > 0;
    }
}
