package org.jellyfinmanager.service.restore;

import lombok.Getter;
import org.jellyfinmanager.model.dto.LibraryItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of live library items by provider key ({@code provider:externalId}) and by secondary key.
 * When two items share a key the last one indexed wins; every such overwrite is kept as a
 * {@link Collision}.
 */
public class IdentityIndex {

    public record Collision(String key, LibraryItem previous, LibraryItem replacement) {
    }

    @Getter
    private final SecondaryKey secondaryKey;
    private final Map<String, LibraryItem> byProviderKey = new HashMap<>();
    private final Map<String, LibraryItem> bySecondaryKey = new HashMap<>();
    private final List<Collision> collisions = new ArrayList<>();

    IdentityIndex(SecondaryKey secondaryKey) {
        this.secondaryKey = secondaryKey;
    }

    public static String providerKey(String provider, String externalId) {
        return provider + ":" + externalId;
    }

    void putProviderKey(String key, LibraryItem item) {
        trackCollision(key, byProviderKey.put(key, item), item);
    }

    void putSecondaryKey(String key, LibraryItem item) {
        trackCollision(key, bySecondaryKey.put(key, item), item);
    }

    private void trackCollision(String key, LibraryItem previous, LibraryItem replacement) {
        if (previous != null && previous != replacement) {
            collisions.add(new Collision(key, previous, replacement));
        }
    }

    public Optional<LibraryItem> findByProviderKey(String key) {
        return Optional.ofNullable(byProviderKey.get(key));
    }

    public Optional<LibraryItem> findBySecondaryKey(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(bySecondaryKey.get(key));
    }

    public List<Collision> getCollisions() {
        return Collections.unmodifiableList(collisions);
    }

    int providerKeyCount() {
        return byProviderKey.size();
    }

    int secondaryKeyCount() {
        return bySecondaryKey.size();
    }
}
