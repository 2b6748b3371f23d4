package com.proxycare.pool.application.health;

public record BlockingDecision(boolean block, BlockReason reason) {

    public static BlockingDecision keep() {
        return new BlockingDecision(false, BlockReason.HEALTHY);
    }

    public static BlockingDecision block(BlockReason reason) {
        return new BlockingDecision(true, reason);
    }
}
