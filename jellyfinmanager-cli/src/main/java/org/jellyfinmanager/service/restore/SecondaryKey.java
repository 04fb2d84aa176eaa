package org.jellyfinmanager.service.restore;

import org.apache.commons.lang3.StringUtils;
import org.jellyfinmanager.model.dto.LibraryItem;
import org.jellyfinmanager.model.dto.WatchedItem;

/**
 * Name based fallback identity of an item, used when no provider id matches.
 */
public enum SecondaryKey {
    NAME {
        @Override
        String of(String name, String seasonName) {
            return name;
        }
    },
    SEASON_AND_NAME {
        @Override
        String of(String name, String seasonName) {
            return StringUtils.defaultString(seasonName) + ":" + name;
        }
    };

    abstract String of(String name, String seasonName);

    public String of(LibraryItem item) {
        return item.getName() == null ? null : of(item.getName(), item.getSeasonName());
    }

    public String of(WatchedItem item) {
        return item.getName() == null ? null : of(item.getName(), item.getSeasonName());
    }
}
