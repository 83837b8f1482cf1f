package dev.talentmatch.model;

import java.util.List;
import java.util.Objects;

final class ModelLists {

    private ModelLists() {
    }

    /**
     * Unmodifiable copy without null entries; null becomes empty.
     */
    static <T> List<T> present(List<T> items) {
        return items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
    }
}
