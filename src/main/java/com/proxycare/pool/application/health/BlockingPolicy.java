package com.proxycare.pool.application.health;

/**
 * Decides from a proxy's recent outcomes whether it should be taken out of rotation.
 * <p>
 * Implementations are pure and never unblock: a proxy comes back only through staleness
 * reconciliation or an operator.
 */
public interface BlockingPolicy {

    BlockingDecision evaluate(OutcomeHistory history);
}
