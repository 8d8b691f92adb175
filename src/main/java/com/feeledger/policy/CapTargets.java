package com.feeledger.policy;

import java.util.List;

/**
 * Selects which prior components a cap constrains. A component is targeted when
 * it matches any of the listed ids, tags, types or scopes. An empty selection
 * targets every prior fee component.
 */
public record CapTargets(List<String> componentIds, List<String> tags, List<ComponentType> types, List<Scope> scopes) {

    public static final CapTargets ALL = new CapTargets(List.of(), List.of(), List.of(), List.of());

    public CapTargets {
        componentIds = componentIds != null ? List.copyOf(componentIds) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
        types = types != null ? List.copyOf(types) : List.of();
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }

    public boolean isEmpty() {
        return componentIds.isEmpty() && tags.isEmpty() && types.isEmpty() && scopes.isEmpty();
    }

    public boolean matches(String componentId, List<String> componentTags, ComponentType type, Scope scope) {
        return componentIds.contains(componentId)
            || componentTags.stream().anyMatch(tags::contains)
            || types.contains(type)
            || scopes.contains(scope);
    }
}
