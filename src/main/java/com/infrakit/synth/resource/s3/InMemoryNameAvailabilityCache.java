package com.infrakit.synth.resource.s3;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryNameAvailabilityCache implements NameAvailabilityCache {

    private final Map<String, Boolean> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<Boolean> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    @Override
    public void record(String name, boolean available) {
        entries.put(name, available);
    }

    public int size() {
        return entries.size();
    }
}
