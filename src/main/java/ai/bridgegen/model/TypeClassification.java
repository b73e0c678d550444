package ai.bridgegen.model;

/**
 * How an aggregate crosses the bridge.
 */
public enum TypeClassification {
    VALUE_SAFE,
    OPAQUE
}
