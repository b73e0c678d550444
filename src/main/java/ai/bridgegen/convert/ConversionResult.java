package ai.bridgegen.convert;

import java.util.List;

import ai.bridgegen.ast.RawAst;
import ai.bridgegen.model.AdditionalNeed;
import ai.bridgegen.model.EncounteredType;

/**
 * Output of one conversion.
 *
 * @param items           rewritten items, ending with the bridge module
 * @param typesToDisable  types the bridge module defines; later generators must not emit them again
 * @param additionalNeeds native helpers the bridge relies on
 */
public record ConversionResult(
        List<RawAst.Item> items,
        List<EncounteredType> typesToDisable,
        List<AdditionalNeed> additionalNeeds
) {
    public ConversionResult {
        items = List.copyOf(items);
        typesToDisable = List.copyOf(typesToDisable);
        additionalNeeds = List.copyOf(additionalNeeds);
    }

    /** The synthesized bridge module, always the last item. */
    public RawAst.Module bridgeModule() {
        return (RawAst.Module) items.get(items.size() - 1);
    }
}
