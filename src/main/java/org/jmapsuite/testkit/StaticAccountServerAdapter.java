package org.jmapsuite.testkit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmapsuite.client.RequestOrchestrator;

/**
 * Adapter over pre-provisioned accounts reachable through one transport.
 */
public final class StaticAccountServerAdapter implements ServerAdapter {
    private final String name;
    private final AccountHandle account;
    private final AccountHandle pristineAccount;

    public StaticAccountServerAdapter(final RequestOrchestrator orchestrator, final String accountId) {
        this(orchestrator, accountId, null);
    }

    public StaticAccountServerAdapter(
            final RequestOrchestrator orchestrator,
            final String accountId,
            final String pristineAccountId) {
        this(orchestrator, accountId, pristineAccountId, List.of());
    }

    public StaticAccountServerAdapter(
            final RequestOrchestrator orchestrator,
            final String accountId,
            final String pristineAccountId,
            final List<String> capabilities) {
        Objects.requireNonNull(orchestrator, "orchestrator");
        this.name = orchestrator.transport().name();
        this.account = new AccountHandle(accountId, orchestrator, capabilities);
        this.pristineAccount = pristineAccountId == null
                ? null
                : new AccountHandle(pristineAccountId, orchestrator, capabilities);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AccountHandle anyAccount() {
        return account;
    }

    @Override
    public Optional<AccountHandle> pristineAccount() {
        return Optional.ofNullable(pristineAccount);
    }
}
