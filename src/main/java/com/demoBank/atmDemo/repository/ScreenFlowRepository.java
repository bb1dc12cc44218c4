package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Screen flows keyed by id, with a unique index on the owning intent.
 */
@Repository
public class ScreenFlowRepository {

    private final Map<String, ScreenFlow> flowsById = new ConcurrentHashMap<>();
    private final Map<String, String> flowIdsByIntent = new ConcurrentHashMap<>();
    private final Cache<String, List<ScreenFlow>> archived = Caffeine.newBuilder()
            .maximumSize(IntentRepository.ARCHIVED_SESSIONS)
            .build();

    public ScreenFlow save(ScreenFlow flow) {
        String previous = flowIdsByIntent.put(flow.getIntentId(), flow.getId());
        if (previous != null && !previous.equals(flow.getId())) {
            flowsById.remove(previous);
        }
        flowsById.put(flow.getId(), flow);
        return flow;
    }

    public Optional<ScreenFlow> findById(String id) {
        return Optional.ofNullable(flowsById.get(id));
    }

    public Optional<ScreenFlow> findByIntentId(String intentId) {
        return Optional.ofNullable(flowIdsByIntent.get(intentId)).map(flowsById::get);
    }

    public int archiveBySessionId(String sessionId) {
        List<ScreenFlow> owned = flowsById.values().stream()
                .filter(flow -> sessionId.equals(flow.getSessionId()))
                .toList();
        if (!owned.isEmpty()) {
            archived.put(sessionId, owned);
        }
        owned.forEach(flow -> {
            flowsById.remove(flow.getId());
            flowIdsByIntent.remove(flow.getIntentId());
        });
        return owned.size();
    }
}
