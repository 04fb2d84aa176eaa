package org.jellyfinmanager.service.restore;

import org.jellyfinmanager.model.dto.LibraryItem;
import org.jellyfinmanager.model.dto.WatchedItem;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Matches backup records to live library items. Provider ids are tried first, in the order the
 * record lists them; the secondary key is the fallback.
 */
@Component
public class IdentityResolver {

    public IdentityIndex build(Collection<LibraryItem> items, SecondaryKey secondaryKey) {
        IdentityIndex index = new IdentityIndex(secondaryKey);
        for (LibraryItem item : items) {
            if (item.getProviderIds() != null) {
                item.getProviderIds().forEach((provider, id) -> index.putProviderKey(IdentityIndex.providerKey(provider, id), item));
            }
            String key = secondaryKey.of(item);
            if (key != null) {
                index.putSecondaryKey(key, item);
            }
        }
        return index;
    }

    public Optional<LibraryItem> resolve(WatchedItem watched, IdentityIndex index) {
        Map<String, String> providerIds = watched.getProviderIds();
        if (providerIds != null) {
            for (Map.Entry<String, String> entry : providerIds.entrySet()) {
                Optional<LibraryItem> hit = index.findByProviderKey(IdentityIndex.providerKey(entry.getKey(), entry.getValue()));
                if (hit.isPresent()) {
                    return hit;
                }
            }
        }
        return index.findBySecondaryKey(index.getSecondaryKey().of(watched));
    }
}
