package com.riskgate.backend.service.bus;

import com.riskgate.backend.config.BusProperties;
import com.riskgate.backend.model.BusMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped fan-out of agent messages. Each session keeps a bounded history
 * that is replayed to late joiners; a session disappears with its last connection
 * unless it is pinned. Sessions are only created by opening or joining them.
 */
@Service
@Slf4j
public class MessageBus {

    private final BusProperties properties;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public MessageBus(BusProperties properties) {
        this.properties = properties;
    }

    public String createSession() {
        String sessionId = UUID.randomUUID().toString().replace("-", "");
        openSession(sessionId);
        return sessionId;
    }

    public void openSession(String sessionId) {
        sessions.computeIfAbsent(sessionId, Session::new);
        log.info("Bus session {} opened", sessionId);
    }

    /**
     * Opens a session that survives having no connections, for the coordinator's own channel.
     */
    public void pinSession(String sessionId) {
        while (true) {
            Session session = sessions.computeIfAbsent(sessionId, Session::new);
            synchronized (session) {
                if (session.closed) {
                    continue;
                }
                session.pinned = true;
            }
            log.info("Bus session {} pinned", sessionId);
            return;
        }
    }

    public List<String> listSessions() {
        return new ArrayList<>(sessions.keySet());
    }

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /**
     * Replays recent history to the connection, then adds it to the session.
     *
     * @return false when the replay failed and the connection was not added
     */
    public boolean register(String sessionId, BusConnection connection) {
        while (true) {
            Session session = sessions.computeIfAbsent(sessionId, Session::new);
            synchronized (session) {
                if (session.closed) {
                    continue;
                }
                List<BusMessage> replay = session.recent(properties.getReplaySize());
                try {
                    for (BusMessage message : replay) {
                        connection.send(message);
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Replay to {} in session {} failed: {}", connection.id(), sessionId, e.getMessage());
                    return false;
                }
                session.connections.add(connection);
                log.info("🔌 {} joined bus session {} ({} replayed, {} connected)",
                        connection.id(), sessionId, replay.size(), session.connections.size());
                return true;
            }
        }
    }

    public void unregister(String sessionId, BusConnection connection) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            if (session.connections.remove(connection)) {
                log.info("{} left bus session {}", connection.id(), sessionId);
                collectIfEmpty(session);
            }
        }
    }

    /**
     * Records the message in the session history and delivers it to every live
     * connection. A connection that fails to receive is dropped; the rest still
     * get the message. Messages for a session that is not open are discarded.
     *
     * @return number of connections the message was delivered to, or -1 when the
     * session is not open
     */
    public int broadcast(String sessionId, BusMessage message) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            log.debug("Bus session {} not open, {} message from {} discarded", sessionId,
                    message.messageType(), message.senderId());
            return -1;
        }
        synchronized (session) {
            if (session.closed) {
                log.debug("Bus session {} closed, message from {} discarded", sessionId, message.senderId());
                return -1;
            }
            session.append(message, properties.getHistorySize());
            int delivered = 0;
            List<BusConnection> failed = new ArrayList<>();
            // A send may close its socket and unregister on this thread
            for (BusConnection connection : List.copyOf(session.connections)) {
                try {
                    connection.send(message);
                    delivered++;
                } catch (IOException | RuntimeException e) {
                    log.warn("Dropping {} from bus session {}: {}", connection.id(), sessionId, e.getMessage());
                    failed.add(connection);
                }
            }
            if (!failed.isEmpty()) {
                failed.forEach(session.connections::remove);
                collectIfEmpty(session);
            }
            return delivered;
        }
    }

    public List<BusMessage> history(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return List.of();
        }
        synchronized (session) {
            return List.copyOf(session.history);
        }
    }

    public int connectionCount(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return 0;
        }
        synchronized (session) {
            return session.connections.size();
        }
    }

    // Caller holds the session monitor
    private void collectIfEmpty(Session session) {
        if (session.connections.isEmpty() && !session.pinned && !session.closed) {
            session.closed = true;
            sessions.remove(session.id, session);
            log.debug("Bus session {} collected", session.id);
        }
    }

    private static final class Session {
        private final String id;
        private final Set<BusConnection> connections = new LinkedHashSet<>();
        private final Deque<BusMessage> history = new ArrayDeque<>();
        private boolean closed;
        private boolean pinned;

        private Session(String id) {
            this.id = id;
        }

        private void append(BusMessage message, int limit) {
            history.addLast(message);
            while (history.size() > limit) {
                history.removeFirst();
            }
        }

        private List<BusMessage> recent(int count) {
            List<BusMessage> all = new ArrayList<>(history);
            return all.subList(Math.max(0, all.size() - count), all.size());
        }
    }
}
