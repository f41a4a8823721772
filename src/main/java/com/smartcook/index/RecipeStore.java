package com.smartcook.index;

import java.util.List;
import java.util.Optional;

public final class RecipeStore {
    private final List<RecipeRecord> records;

    public RecipeStore(List<RecipeRecord> records) {
        for (int position = 0; position < records.size(); position++) {
            if (records.get(position).id() != position) {
                throw new IllegalArgumentException("Recipe at position " + position + " carries id "
                        + records.get(position).id());
            }
        }
        this.records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public Optional<RecipeRecord> find(int id) {
        if (id < 0 || id >= records.size()) {
            return Optional.empty();
        }
        return Optional.of(records.get(id));
    }

    public List<RecipeRecord> records() {
        return records;
    }
}
