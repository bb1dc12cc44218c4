package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.bank.model.Card;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class CardRepository {

    private final Map<String, Card> cardsById = new ConcurrentHashMap<>();
    private final Map<String, String> cardIdsByPan = new ConcurrentHashMap<>();

    public Card save(Card card) {
        cardsById.put(card.getId(), card);
        cardIdsByPan.put(card.getPan(), card.getId());
        return card;
    }

    public Optional<Card> findById(String id) {
        return Optional.ofNullable(cardsById.get(id));
    }

    public Optional<Card> findByPan(String pan) {
        return Optional.ofNullable(cardIdsByPan.get(pan)).map(cardsById::get);
    }

    public List<Card> findByCustomerId(String customerId) {
        return cardsById.values().stream()
                .filter(card -> customerId.equals(card.getCustomerId()))
                .toList();
    }
}
