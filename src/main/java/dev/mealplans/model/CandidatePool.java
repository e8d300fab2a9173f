package dev.mealplans.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the recipes eligible for one user, in provider order.
 */
public final class CandidatePool {

    private final Map<Long, CandidateRecipe> byId;

    public CandidatePool(Collection<CandidateRecipe> recipes) {
        var map = new LinkedHashMap<Long, CandidateRecipe>();
        for (CandidateRecipe recipe : recipes) {
            map.put(recipe.id(), recipe);
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    public static CandidatePool of(CandidateRecipe... recipes) {
        return new CandidatePool(List.of(recipes));
    }

    public int size() {
        return byId.size();
    }

    public List<CandidateRecipe> all() {
        return List.copyOf(byId.values());
    }

    public Optional<CandidateRecipe> find(Long id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    /** Recipes carrying every one of the given tags, case-insensitively. */
    public List<CandidateRecipe> withTags(Collection<String> tags) {
        return byId.values().stream().filter(r -> r.hasAllTags(tags)).toList();
    }

    /**
     * Recipes carrying at least one of the preferred tags. An empty preference set
     * keeps the whole pool.
     */
    public CandidatePool forPreferences(Set<String> preferences) {
        if (preferences == null || preferences.isEmpty()) {
            return this;
        }
        return new CandidatePool(byId.values().stream()
            .filter(r -> preferences.stream().anyMatch(r::hasTag))
            .toList());
    }
}
