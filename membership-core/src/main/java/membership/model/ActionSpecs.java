package membership.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup of {@link ActionSpec}s by {@link ActionType}.
 *
 * <p>Later specs for the same type replace earlier ones.
 */
public final class ActionSpecs {
    private final Map<ActionType, ActionSpec> specs;

    private ActionSpecs(Map<ActionType, ActionSpec> specs) {
        this.specs = Collections.unmodifiableMap(specs);
    }

    public static ActionSpecs of(Collection<ActionSpec> specs) {
        Objects.requireNonNull(specs, "specs");
        Map<ActionType, ActionSpec> byType = new EnumMap<>(ActionType.class);
        for (ActionSpec spec : specs) {
            Objects.requireNonNull(spec, "spec");
            byType.put(spec.type(), spec);
        }
        return new ActionSpecs(byType);
    }

    public Optional<ActionSpec> find(ActionType type) {
        return Optional.ofNullable(specs.get(type));
    }

    /**
     * Returns the spec for the given type.
     *
     * @throws IllegalArgumentException if no spec is configured for {@code type}
     */
    public ActionSpec require(ActionType type) {
        ActionSpec spec = specs.get(type);
        if (spec == null) {
            throw new IllegalArgumentException("No action spec configured for " + type.label());
        }
        return spec;
    }

    /** Returns the day offset for an expiry type, or empty if none is configured. */
    public Optional<Integer> offset(ActionType type) {
        return find(type).map(ActionSpec::offset);
    }

    public Collection<ActionSpec> all() {
        return specs.values();
    }
}
