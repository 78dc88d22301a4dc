package in.tickbridge.infrastructure.broker.data;

/**
 * Exception thrown when a subscription is requested on a session whose
 * upstream link is down.
 */
public class FeedNotConnectedException extends RuntimeException {

    private final String brokerCode;
    private final String userId;

    public FeedNotConnectedException(String brokerCode, String userId, String message) {
        super(String.format("[%s:%s] %s", brokerCode, userId, message));
        this.brokerCode = brokerCode;
        this.userId = userId;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getUserId() {
        return userId;
    }
}
