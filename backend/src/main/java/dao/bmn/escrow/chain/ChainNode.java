package dao.bmn.escrow.chain;

import dao.bmn.escrow.auth.AuthorizationPolicy;
import dao.bmn.escrow.auth.EcdsaSignatureVerifier;
import dao.bmn.escrow.auth.EndorsedSignaturePolicy;
import dao.bmn.escrow.auth.TokenHolderPolicy;
import dao.bmn.escrow.escrow.EscrowContext;
import dao.bmn.escrow.escrow.EscrowFactory;
import dao.bmn.escrow.escrow.FactorySettings;
import dao.bmn.escrow.event.EscrowJournal;
import dao.bmn.escrow.ledger.InMemoryTokenLedger;
import dao.bmn.escrow.ledger.TokenLedger;
import dao.bmn.escrow.repository.FactoryRegistry;
import dao.bmn.escrow.repository.InMemoryFactoryRegistry;
import lombok.Getter;

/**
 * One ledger in this process: its tokens, its log, its clock and the factory deployed on it.
 */
@Getter
public class ChainNode {

    private final long chainId;
    private final String name;
    private final ChainClock clock;
    private final TokenLedger ledger;
    private final EscrowJournal journal;
    private final FactoryRegistry registry;
    private final EscrowFactory factory;

    private ChainNode(long chainId, String name, ChainClock clock, TokenLedger ledger, EscrowJournal journal,
                      FactoryRegistry registry, EscrowFactory factory) {
        this.chainId = chainId;
        this.name = name;
        this.clock = clock;
        this.ledger = ledger;
        this.journal = journal;
        this.registry = registry;
        this.factory = factory;
    }

    /**
     * Public actions are open to holders of {@code accessToken} and to callers endorsed by a
     * whitelisted resolver.
     */
    public static ChainNode create(long chainId,
                                   String name,
                                   String factoryAddress,
                                   String owner,
                                   String accessToken,
                                   FactorySettings settings,
                                   ChainClock clock) {
        TokenLedger ledger = new InMemoryTokenLedger(chainId);
        EscrowJournal journal = new EscrowJournal(chainId, clock);
        FactoryRegistry registry = new InMemoryFactoryRegistry(owner);
        AuthorizationPolicy policy = AuthorizationPolicy.anyOf(
                new TokenHolderPolicy(ledger, accessToken),
                new EndorsedSignaturePolicy(registry, new EcdsaSignatureVerifier())
        );
        EscrowContext context = new EscrowContext(chainId, ledger, journal, clock, policy);
        EscrowFactory factory = new EscrowFactory(factoryAddress, context, registry, settings);
        return new ChainNode(chainId, name, clock, ledger, journal, registry, factory);
    }
}
