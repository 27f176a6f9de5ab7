package membership;

import membership.spi.MetricsExporter;

/**
 * Counts metric calls.
 */
public class RecordingMetricsExporter implements MetricsExporter {
    public int joined;
    public int renewed;
    public int ambiguous;
    public int failed;
    public int expiryGenerated;
    public int delivered;
    public int retried;
    public int dead;
    public int lastQueueDepth = -1;

    @Override
    public void incrementTransactionsJoined() {
        joined++;
    }

    @Override
    public void incrementTransactionsRenewed() {
        renewed++;
    }

    @Override
    public void incrementTransactionsAmbiguous() {
        ambiguous++;
    }

    @Override
    public void incrementTransactionsFailed() {
        failed++;
    }

    @Override
    public void incrementExpiryGenerated(int count) {
        expiryGenerated += count;
    }

    @Override
    public void incrementQueueDelivered() {
        delivered++;
    }

    @Override
    public void incrementQueueRetried() {
        retried++;
    }

    @Override
    public void incrementQueueDead() {
        dead++;
    }

    @Override
    public void recordQueueDepth(int depth) {
        lastQueueDepth = depth;
    }
}
