package com.purchasingpower.codegen.model.ir;

/**
 * Where in the IR an unresolved typed hole appears.
 */
public enum HoleKind {
    INTENT,
    SIGNATURE,
    EFFECT,
    ASSERTION,
    IMPLEMENTATION
}
