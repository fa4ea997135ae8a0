package com.routewise.core.registry;

import com.routewise.core.handler.Handler;
import com.routewise.core.model.HandlerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the registered handlers and their declared capability metadata.
 * <p>
 * Iteration order is registration order; re-registering an id replaces the
 * descriptor and handler in place (last write wins, position kept). Reads see
 * an immutable snapshot, so routing never blocks on registration.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    /**
     * A descriptor paired with the handler that executes it.
     */
    public record Registration(HandlerDescriptor descriptor, Handler handler) {
        public String id() {
            return descriptor.id();
        }
    }

    private final Object writeLock = new Object();
    private volatile Map<String, Registration> registrations = Map.of();

    public void register(HandlerDescriptor descriptor, Handler handler) {
        if (descriptor == null || handler == null) {
            throw new IllegalArgumentException("Descriptor and handler are required");
        }
        synchronized (writeLock) {
            var next = new LinkedHashMap<>(registrations);
            boolean replaced = next.containsKey(descriptor.id());
            next.put(descriptor.id(), new Registration(descriptor, handler));
            registrations = Collections.unmodifiableMap(next);
            log.info("{} handler '{}' (capabilities={}, primary={})",
                    replaced ? "Replaced" : "Registered", descriptor.id(),
                    descriptor.capabilities(), descriptor.primaryTaskTypes());
        }
    }

    public Optional<Registration> find(String handlerId) {
        return Optional.ofNullable(registrations.get(handlerId));
    }

    /**
     * All registrations in registration order.
     */
    public List<Registration> registrations() {
        return List.copyOf(registrations.values());
    }

    public List<HandlerDescriptor> descriptors() {
        var result = new ArrayList<HandlerDescriptor>();
        for (var registration : registrations.values()) {
            result.add(registration.descriptor());
        }
        return result;
    }

    public List<String> handlerIds() {
        return List.copyOf(registrations.keySet());
    }

    public int size() {
        return registrations.size();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }
}
