package com.tradingstore.store.dto;

public record BetaCodeStats(long total, long used) {

    public long remaining() {
        return total - used;
    }
}
