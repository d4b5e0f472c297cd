package com.purchasingpower.codegen.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Unresolved value placeholder in the IR. Resolution happens upstream; holes are carried
 * through and rendered into prompts so the generator knows what is still open.
 */
@Value
@Builder
@Jacksonized
public class TypedHole {
    String identifier;
    String typeHint;
    String description;
    @Builder.Default
    HoleKind kind = HoleKind.INTENT;

    /**
     * Compact label such as {@code <?limit: int?>}.
     */
    public String label() {
        return String.format("<?%s: %s?>", identifier, typeHint);
    }
}
