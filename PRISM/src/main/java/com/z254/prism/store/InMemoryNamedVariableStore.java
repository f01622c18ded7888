package com.z254.prism.store;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local variable store. Contents are lost on restart.
 */
@Repository
public class InMemoryNamedVariableStore implements NamedVariableStore {

    private final Map<String, Object> store = new ConcurrentHashMap<>();

    @Override
    public Optional<Object> get(String name) {
        return Optional.ofNullable(store.get(name));
    }

    @Override
    public void set(String name, Object value) {
        store.put(name, value);
    }

    @Override
    public boolean delete(String name) {
        return store.remove(name) != null;
    }

    @Override
    public Set<String> names() {
        return new TreeSet<>(store.keySet());
    }
}
