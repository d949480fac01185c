package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A public package-init file of the downstream package.
 *
 * <p>The segments are the directories between the package root and the
 * file, so the package's own {@code __init__.py} has no segments. The
 * file content is not held here: it is read by the extractor inside the
 * worker that analyzes the module.</p>
 *
 * @param packageName the downstream package directory name
 * @param segments the directory segments below the package root
 * @param file the location of the package-init file
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EntryPointModule(
        String packageName,
        List<String> segments,
        Path file
) {

    /** The file name that marks a directory as a package. */
    public static final String INIT_FILE = "__init__.py";

    /**
     * Creates a new entry point module.
     *
     * @param packageName the downstream package name, never blank
     * @param segments the directory segments, never null
     * @param file the init file location, never null
     */
    public EntryPointModule {
        Preconditions.requireNonBlank(packageName,
                "Package name is required");
        Preconditions.requireNonNull(segments, "Segments are required");
        Preconditions.requireNonNull(file, "File is required");
        segments = List.copyOf(segments);
    }

    /**
     * Returns the dotted module path, e.g. {@code langchain.chat_models}.
     *
     * @return the dotted module path including the package name
     */
    public String modulePath() {
        if (segments.isEmpty()) {
            return packageName;
        }
        return packageName + "." + String.join(".", segments);
    }

    /**
     * Returns the file location relative to the source root, using forward
     * slashes regardless of the platform.
     *
     * @return e.g. {@code langchain/chat_models/__init__.py}
     */
    public String relativeFile() {
        final List<String> parts = new ArrayList<>(segments.size() + 2);
        parts.add(packageName);
        parts.addAll(segments);
        parts.add(INIT_FILE);
        return String.join("/", parts);
    }

}
