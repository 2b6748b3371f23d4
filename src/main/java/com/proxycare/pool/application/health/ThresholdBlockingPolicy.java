package com.proxycare.pool.application.health;

import com.proxycare.pool.config.ProxyPoolProperties;

import java.util.Set;

/**
 * Blocks on a transport failure, on repeated "proxy is unusable" statuses, or when most
 * of a large enough window failed. Only ever blocks right after a failing outcome.
 */
public class ThresholdBlockingPolicy implements BlockingPolicy {

    private final int transportFailureStatus;
    private final Set<Integer> blockingStatuses;
    private final int failureThreshold;
    private final int minSamples;
    private final double maxFailureRatio;

    public ThresholdBlockingPolicy(ProxyPoolProperties.Blocking config) {
        this.transportFailureStatus = config.getTransportFailureStatus();
        this.blockingStatuses = Set.copyOf(config.getBlockingStatuses());
        this.failureThreshold = config.getFailureThreshold();
        this.minSamples = config.getMinSamples();
        this.maxFailureRatio = config.getMaxFailureRatio();
    }

    @Override
    public BlockingDecision evaluate(OutcomeHistory history) {
        Integer latest = (history == null) ? null : history.latest();
        if (latest == null || !OutcomeHistory.isFailure(latest)) {
            return BlockingDecision.keep();
        }

        if (latest == transportFailureStatus) {
            return BlockingDecision.block(BlockReason.TRANSPORT_FAILURE);
        }

        if (isBlockingStatus(latest)) {
            long repeated = history.statuses().stream().filter(this::isBlockingStatus).count();
            if (repeated >= failureThreshold) {
                return BlockingDecision.block(BlockReason.REPEATED_FAILURES);
            }
        }

        if (history.size() >= minSamples && history.failureRatio() >= maxFailureRatio) {
            return BlockingDecision.block(BlockReason.FAILURE_RATIO);
        }

        return BlockingDecision.keep();
    }

    private boolean isBlockingStatus(Integer status) {
        return status != null && (blockingStatuses.contains(status) || status == transportFailureStatus);
    }
}
