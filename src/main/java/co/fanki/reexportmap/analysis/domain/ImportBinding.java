package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;

/**
 * A name bound in a module's namespace by an import from the upstream
 * package.
 *
 * <p>For {@code from langchain_core.tools import BaseTool as Tool} the
 * local name is {@code Tool}, the original name {@code BaseTool} and the
 * origin module {@code langchain_core.tools}.</p>
 *
 * @param localName the name as seen inside the importing module
 * @param originModule the upstream module the name is imported from
 * @param originalName the name as defined in the upstream module
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportBinding(
        String localName,
        String originModule,
        String originalName
) {

    /**
     * Creates a new import binding.
     *
     * @param localName the local name, never blank
     * @param originModule the origin module, never blank
     * @param originalName the original name, never blank
     */
    public ImportBinding {
        Preconditions.requireNonBlank(localName, "Local name is required");
        Preconditions.requireNonBlank(originModule,
                "Origin module is required");
        Preconditions.requireNonBlank(originalName,
                "Original name is required");
    }

    /**
     * Returns the origin of the bound symbol.
     *
     * @return the origin module and original name
     */
    public ImportOrigin origin() {
        return new ImportOrigin(originModule, originalName);
    }

    /**
     * Checks whether the binding was renamed with {@code as}.
     *
     * @return true if the local name differs from the original name
     */
    public boolean isAliased() {
        return !localName.equals(originalName);
    }

}
