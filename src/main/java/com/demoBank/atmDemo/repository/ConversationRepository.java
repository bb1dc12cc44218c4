package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.orchestrator.model.ConversationMessage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only conversation log per session. Messages are never edited; the end of a session moves the
 * whole log to a bounded archive.
 */
@Repository
public class ConversationRepository {

    private final Map<String, List<ConversationMessage>> logs = new ConcurrentHashMap<>();
    private final Cache<String, List<ConversationMessage>> archived = Caffeine.newBuilder()
            .maximumSize(IntentRepository.ARCHIVED_SESSIONS)
            .build();

    public void append(ConversationMessage message) {
        logs.computeIfAbsent(message.getSessionId(), key -> Collections.synchronizedList(new ArrayList<>()))
                .add(message);
    }

    public List<ConversationMessage> findBySessionId(String sessionId) {
        List<ConversationMessage> log = logs.get(sessionId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    public int archive(String sessionId) {
        List<ConversationMessage> log = logs.remove(sessionId);
        if (log == null) {
            return 0;
        }
        List<ConversationMessage> copy;
        synchronized (log) {
            copy = List.copyOf(log);
        }
        archived.put(sessionId, copy);
        return copy.size();
    }

    public List<ConversationMessage> findArchived(String sessionId) {
        List<ConversationMessage> log = archived.getIfPresent(sessionId);
        return log == null ? List.of() : log;
    }
}
