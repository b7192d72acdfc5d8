package com.company.sladashboard.bus;

import com.company.sladashboard.invalidation.CacheKeys;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One connected client with its subscribed keys. A session without subscriptions receives every event.
 */
class BusSession {

    private final WebSocketSession session;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private volatile Instant lastSeen;

    BusSession(WebSocketSession session, Instant connectedAt) {
        this.session = session;
        this.lastSeen = connectedAt;
    }

    WebSocketSession getSession() {
        return session;
    }

    String getId() {
        return session.getId();
    }

    void touch(Instant now) {
        lastSeen = now;
    }

    Instant getLastSeen() {
        return lastSeen;
    }

    void subscribe(String key) {
        subscriptions.add(key);
    }

    void unsubscribe(String key) {
        subscriptions.remove(key);
    }

    Set<String> getSubscriptions() {
        return Set.copyOf(subscriptions);
    }

    boolean accepts(Collection<String> affectedKeys) {
        if (subscriptions.isEmpty()) {
            return true;
        }
        if (affectedKeys == null || affectedKeys.isEmpty()) {
            return false;
        }
        for (String affected : affectedKeys) {
            for (String subscribed : subscriptions) {
                if (CacheKeys.matches(affected, subscribed)) {
                    return true;
                }
            }
        }
        return false;
    }
}
