package com.chainbridge.payment.gateway.iso20022;

import lombok.Value;

/**
 * Per-adapter operational counters. All access is synchronized on the instance.
 */
public class AdapterStatistics {

    private long messagesParsed;
    private long messagesGenerated;

    public synchronized void recordParsed() {
        messagesParsed++;
    }

    public synchronized void recordGenerated() {
        messagesGenerated++;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(messagesParsed, messagesGenerated);
    }

    public synchronized void reset() {
        messagesParsed = 0;
        messagesGenerated = 0;
    }

    /**
     * Point-in-time copy of the counters.
     */
    @Value
    public static class Snapshot {
        long messagesParsed;
        long messagesGenerated;
    }
}
