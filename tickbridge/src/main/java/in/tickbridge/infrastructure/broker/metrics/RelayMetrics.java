package in.tickbridge.infrastructure.broker.metrics;

import in.tickbridge.domain.feed.FeedClass;

/**
 * Relay metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Upstream handshake outcomes
 * - Re-subscription frames sent / failed
 * - Ticks delivered, dropped, and per-viewer delivery failures
 * - Reconnect attempts
 * - Live sessions
 */
public interface RelayMetrics {

    /**
     * Record the outcome of one upstream handshake.
     *
     * @param outcome ACCEPTED, TIMEOUT, REJECTED or TRANSPORT_ERROR
     */
    void recordHandshake(String outcome);

    /**
     * Record a batched re-subscription frame.
     *
     * @param feedClass class the frame was sent for
     * @param symbolCount number of instruments in the frame
     * @param success whether the send completed
     */
    void recordResubscription(FeedClass feedClass, int symbolCount, boolean success);

    /**
     * Record one tick fanned out to {@code handles} viewers.
     */
    void recordTickDelivered(FeedClass feedClass, int handles);

    /**
     * Record a tick with no subscribers.
     */
    void recordTickDropped();

    /**
     * Record a failed send to one viewer.
     */
    void recordDeliveryFailure();

    /**
     * Record a scheduled reconnect.
     *
     * @param attemptNumber 1-based attempt number
     */
    void recordReconnectScheduled(int attemptNumber);

    void setActiveSessions(int count);

    RelayMetrics NOOP = new RelayMetrics() {
        @Override
        public void recordHandshake(String outcome) {
        }

        @Override
        public void recordResubscription(FeedClass feedClass, int symbolCount, boolean success) {
        }

        @Override
        public void recordTickDelivered(FeedClass feedClass, int handles) {
        }

        @Override
        public void recordTickDropped() {
        }

        @Override
        public void recordDeliveryFailure() {
        }

        @Override
        public void recordReconnectScheduled(int attemptNumber) {
        }

        @Override
        public void setActiveSessions(int count) {
        }
    };
}
