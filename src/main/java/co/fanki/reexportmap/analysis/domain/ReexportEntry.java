package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;

/**
 * A public name of a downstream module that is forwarded from the upstream
 * package.
 *
 * @param localName the exported name
 * @param origin where the symbol is defined upstream
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReexportEntry(String localName, ImportOrigin origin) {

    /**
     * Creates a new re-export entry.
     *
     * @param localName the exported name, never blank
     * @param origin the upstream origin, never null
     */
    public ReexportEntry {
        Preconditions.requireNonBlank(localName, "Local name is required");
        Preconditions.requireNonNull(origin, "Origin is required");
    }

}
