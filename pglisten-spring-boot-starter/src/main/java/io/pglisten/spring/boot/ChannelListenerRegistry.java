package io.pglisten.spring.boot;

import io.pglisten.ChannelRegistration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects the channel registrations the application context contributes, one per channel.
 */
public class ChannelListenerRegistry {

    private final Map<String, ChannelRegistration> registrations = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException if the channel already has a handler
     */
    public synchronized void register(ChannelRegistration registration) {
        Objects.requireNonNull(registration, "registration");
        ChannelRegistration existing = registrations.putIfAbsent(registration.channel(), registration);
        if (existing != null) {
            throw new IllegalStateException("Channel '" + registration.channel()
                    + "' already has a handler: " + existing.handler());
        }
    }

    public synchronized List<ChannelRegistration> registrations() {
        return List.copyOf(new ArrayList<>(registrations.values()));
    }
}
