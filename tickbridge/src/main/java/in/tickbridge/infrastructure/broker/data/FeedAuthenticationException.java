package in.tickbridge.infrastructure.broker.data;

/**
 * Exception thrown when a viewer presents a credential that cannot be used
 * against the broker feed.
 */
public class FeedAuthenticationException extends RuntimeException {

    public FeedAuthenticationException(String message) {
        super(message);
    }
}
