package ai.bridgegen.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import ai.bridgegen.model.QualifiedName;
import ai.bridgegen.model.TypeClassification;

/**
 * Verdict per ingested aggregate, fixed once computed.
 */
public final class Classification {

    private final Map<QualifiedName, TypeClassification> verdicts;

    Classification(Map<QualifiedName, TypeClassification> verdicts) {
        this.verdicts = Collections.unmodifiableMap(new LinkedHashMap<>(verdicts));
    }

    public TypeClassification verdict(QualifiedName name) {
        Objects.requireNonNull(name, "name");
        return verdicts.getOrDefault(name, TypeClassification.OPAQUE);
    }

    public boolean isValueSafe(QualifiedName name) {
        return verdict(name) == TypeClassification.VALUE_SAFE;
    }

    public Map<QualifiedName, TypeClassification> verdicts() {
        return verdicts;
    }
}
