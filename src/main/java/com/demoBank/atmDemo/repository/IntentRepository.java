package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class IntentRepository {

    /**
     * Sessions whose intents are kept after archival; older ones are dropped first.
     */
    public static final int ARCHIVED_SESSIONS = 1_000;

    private final Map<String, TransactionIntent> intents = new ConcurrentHashMap<>();
    private final Cache<String, List<TransactionIntent>> archived = Caffeine.newBuilder()
            .maximumSize(ARCHIVED_SESSIONS)
            .build();

    public TransactionIntent save(TransactionIntent intent) {
        intents.put(intent.getId(), intent);
        return intent;
    }

    public Optional<TransactionIntent> findById(String id) {
        return Optional.ofNullable(intents.get(id));
    }

    public List<TransactionIntent> findBySessionId(String sessionId) {
        return intents.values().stream()
                .filter(intent -> sessionId.equals(intent.getSessionId()))
                .sorted(Comparator.comparing(TransactionIntent::getCreatedAt))
                .toList();
    }

    /**
     * Moves every intent of the session out of the live store.
     *
     * @return number of intents archived
     */
    public int archiveBySessionId(String sessionId) {
        List<TransactionIntent> owned = findBySessionId(sessionId);
        if (!owned.isEmpty()) {
            archived.put(sessionId, owned);
        }
        owned.forEach(intent -> intents.remove(intent.getId()));
        return owned.size();
    }

    public List<TransactionIntent> findArchived(String sessionId) {
        List<TransactionIntent> owned = archived.getIfPresent(sessionId);
        return owned == null ? List.of() : owned;
    }
}
