package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.bank.model.Customer;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class CustomerRepository {

    private final Map<String, Customer> customers = new ConcurrentHashMap<>();

    public Customer save(Customer customer) {
        customers.put(customer.getId(), customer);
        return customer;
    }

    public Optional<Customer> findById(String id) {
        return Optional.ofNullable(customers.get(id));
    }

    /**
     * Replaces the stored snapshot atomically. Returns the new snapshot, or empty if the customer is unknown.
     */
    public Optional<Customer> update(String id, UnaryOperator<Customer> change) {
        return Optional.ofNullable(customers.computeIfPresent(id, (key, current) -> change.apply(current)));
    }
}
