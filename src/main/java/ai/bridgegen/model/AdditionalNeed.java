package ai.bridgegen.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * JSONL line for needs.jsonl
 * <p>
 * Native helper code which must exist for the bridge to link.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "need")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AdditionalNeed.MakeUnique.class, name = "make_unique")
})
public sealed interface AdditionalNeed permits AdditionalNeed.MakeUnique {

    QualifiedName type();

    /**
     * Factory {@code T_make_unique(args...)} returning an owning pointer to a new {@code T}.
     */
    record MakeUnique(QualifiedName type, List<QualifiedName> constructorArgs) implements AdditionalNeed {
        public MakeUnique {
            Objects.requireNonNull(type, "type");
            constructorArgs = constructorArgs != null ? List.copyOf(constructorArgs) : List.of();
        }
    }
}
