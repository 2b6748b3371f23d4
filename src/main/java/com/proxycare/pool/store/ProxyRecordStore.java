package com.proxycare.pool.store;

import com.proxycare.common.exception.ConflictException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.common.exception.PoolFailureException;
import com.proxycare.pool.domain.proxy.Proxy;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The pool's only shared mutable state. Every mutation is atomic for one proxy row, or
 * for one source's rows in {@link #unblockAllForSource(Long, Instant)}; callers never see a partial update.
 * <p>
 * Implementations report store outages as {@link PoolFailureException} with reason
 * {@code UNAVAILABLE}.
 */
public interface ProxyRecordStore {

    /**
     * @throws NotFoundException when no proxy has this id
     */
    Proxy get(Long proxyId);

    boolean sourceExists(Long sourceId);

    /** Ids of every known source, ascending. */
    List<Long> sourceIds();

    /**
     * Unblocked proxies of the source, highest priority first, lowest id first among equals.
     */
    List<Proxy> listEligible(Long sourceId);

    /**
     * Stamps {@code lastTouched = now} if the proxy is unblocked and its cooldown has elapsed
     * since the previous touch. The check and the write are one compare-and-set.
     *
     * @throws ConflictException when the proxy is blocked, still cooling down, or was taken concurrently
     * @throws NotFoundException when no proxy has this id
     */
    void markAssigned(Long proxyId, Instant now);

    /**
     * Sets the blocked flag and stamps {@code lastTouched = now}.
     *
     * @throws NotFoundException when no proxy has this id
     */
    void setBlocked(Long proxyId, boolean blocked, Instant now);

    /**
     * Unblocks every blocked proxy of the source in one batch, provided no proxy of the source
     * was touched (or created, if never touched) at or after {@code cutoff}. The check and the
     * update are one atomic step. {@code lastTouched} is left alone so the rescued proxies are
     * assignable straight away.
     *
     * @return number of proxies that were blocked and now are not; 0 when the source turned out fresh
     */
    int unblockAllForSource(Long sourceId, Instant cutoff);

    /**
     * Latest activity over the source's proxies: {@code lastTouched}, or {@code createdAt} for a
     * proxy never touched. Empty only when the source has no proxies.
     */
    Optional<Instant> mostRecentTouch(Long sourceId);
}
