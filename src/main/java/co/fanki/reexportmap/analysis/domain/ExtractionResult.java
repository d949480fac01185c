package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;

import java.util.List;

/**
 * The facts extracted from one module's source.
 *
 * <p>Both lists keep source order. Bindings are not de-duplicated: a name
 * imported twice appears twice, and the {@link ReexportResolver} decides
 * which one is kept.</p>
 *
 * @param bindings the upstream import bindings in source order
 * @param exports the {@code __all__} names in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtractionResult(
        List<ImportBinding> bindings,
        List<String> exports
) {

    /**
     * Creates a new extraction result.
     *
     * @param bindings the bindings, never null
     * @param exports the exports, never null
     */
    public ExtractionResult {
        Preconditions.requireNonNull(bindings, "Bindings are required");
        Preconditions.requireNonNull(exports, "Exports are required");
        bindings = List.copyOf(bindings);
        exports = List.copyOf(exports);
    }

}
