package membership.spi;

/**
 * Observability hook for exporting membership counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards everything. See the micrometer module for
 * a Micrometer-backed implementation.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /** A paid transaction created a new member. */
    void incrementTransactionsJoined();

    /** A paid transaction renewed an existing member. */
    void incrementTransactionsRenewed();

    /** A paid transaction matched several members and was set aside. */
    void incrementTransactionsAmbiguous();

    /** Applying a transaction failed; it stays unprocessed. */
    void incrementTransactionsFailed();

    /**
     * Due expiry reminders consumed from the schedule.
     *
     * @param count number of entries consumed in one run
     */
    void incrementExpiryGenerated(int count);

    /** A queued expiry item completed all its side effects. */
    void incrementQueueDelivered();

    /** A queued expiry item failed and was rescheduled. */
    void incrementQueueRetried();

    /** A queued expiry item exhausted its attempts. */
    void incrementQueueDead();

    /**
     * Records the number of live items in the expiry queue after a run.
     *
     * @param depth queue depth
     */
    void recordQueueDepth(int depth);

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTransactionsJoined() {
        }

        @Override
        public void incrementTransactionsRenewed() {
        }

        @Override
        public void incrementTransactionsAmbiguous() {
        }

        @Override
        public void incrementTransactionsFailed() {
        }

        @Override
        public void incrementExpiryGenerated(int count) {
        }

        @Override
        public void incrementQueueDelivered() {
        }

        @Override
        public void incrementQueueRetried() {
        }

        @Override
        public void incrementQueueDead() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
