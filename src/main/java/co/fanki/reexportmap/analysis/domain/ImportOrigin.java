package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;

/**
 * Where an upstream symbol is actually defined.
 *
 * @param originModule the upstream module, e.g. {@code langchain_core.tools}
 * @param originalName the name as defined in that module
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportOrigin(String originModule, String originalName) {

    /**
     * Creates a new import origin.
     *
     * @param originModule the upstream module, never blank
     * @param originalName the defined name, never blank
     */
    public ImportOrigin {
        Preconditions.requireNonBlank(originModule,
                "Origin module is required");
        Preconditions.requireNonBlank(originalName,
                "Original name is required");
    }

}
