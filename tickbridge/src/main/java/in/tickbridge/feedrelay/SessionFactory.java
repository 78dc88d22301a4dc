package in.tickbridge.feedrelay;

/**
 * Builds a fresh {@link FeedSession} for a credential.
 */
@FunctionalInterface
public interface SessionFactory {

    FeedSession create(String userId, String credential);
}
