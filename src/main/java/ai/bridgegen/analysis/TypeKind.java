package ai.bridgegen.analysis;

/**
 * How an analysed struct is represented in the bridge.
 */
public enum TypeKind {
    /** Plain data, passed by value with visible fields. */
    POD,
    /** Only reachable through pointers or references. */
    OPAQUE
}
