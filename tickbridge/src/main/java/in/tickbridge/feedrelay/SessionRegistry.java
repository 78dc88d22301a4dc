package in.tickbridge.feedrelay;

import in.tickbridge.infrastructure.broker.metrics.RelayMetrics;
import in.tickbridge.security.CredentialValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Finds or creates the {@link FeedSession} for a credential.
 */
public final class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    // credential -> session
    private final ConcurrentMap<String, FeedSession> sessions = new ConcurrentHashMap<>();

    private final SessionFactory factory;
    private final RelayMetrics metrics;

    public SessionRegistry(SessionFactory factory, RelayMetrics metrics) {
        this.factory = factory;
        this.metrics = metrics;
    }

    public FeedSession findOrCreate(String userId, String credential) {
        FeedSession session = sessions.computeIfAbsent(credential, c -> {
            log.info("[REGISTRY] New session for user={} (token={})", userId, CredentialValidator.mask(c));
            return factory.create(userId, c);
        });
        metrics.setActiveSessions(sessions.size());
        return session;
    }

    public Optional<FeedSession> find(String credential) {
        return Optional.ofNullable(sessions.get(credential));
    }

    /**
     * Remove the session and shut its link down.
     *
     * @return true if a session was registered for the credential
     */
    public boolean evict(String credential) {
        FeedSession session = sessions.remove(credential);
        metrics.setActiveSessions(sessions.size());
        if (session == null) {
            return false;
        }
        log.info("[REGISTRY] Evicting session for user={}", session.getUserId());
        session.shutdown();
        return true;
    }

    public void closeAll() {
        List<String> credentials = new ArrayList<>(sessions.keySet());
        for (String credential : credentials) {
            evict(credential);
        }
    }

    public int size() {
        return sessions.size();
    }
}
