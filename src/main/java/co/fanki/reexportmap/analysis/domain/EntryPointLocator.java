package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Discovers the public package-init files of a Python package.
 *
 * <p>Every {@code __init__.py} below the package directory is a candidate.
 * A candidate is dropped when any directory between the package root and
 * the file starts with an underscore, since private subpackages such as
 * {@code _api} are not part of the documented surface.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EntryPointLocator {

    private static final Logger LOG = LoggerFactory.getLogger(
            EntryPointLocator.class);

    private static final String PRIVATE_PREFIX = "_";

    /**
     * Locates the public entry points of a package.
     *
     * @param sourceRoot the directory holding the package directory
     * @param packageName the package directory name, e.g. "langchain"
     * @return entry points sorted by module path, empty if the package
     *         directory does not exist
     * @throws IOException if walking the directory tree fails, including
     *         errors raised while iterating it
     */
    public List<EntryPointModule> locate(final Path sourceRoot,
            final String packageName) throws IOException {
        Preconditions.requireNonNull(sourceRoot, "Source root is required");
        Preconditions.requireNonBlank(packageName,
                "Package name is required");

        final Path packageDir = sourceRoot.resolve(packageName);
        if (!Files.isDirectory(packageDir)) {
            LOG.warn("Package directory not found: {}", packageDir);
            return List.of();
        }

        final List<EntryPointModule> modules = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(packageDir)) {
            walk.filter(Files::isRegularFile)
                    .filter(p -> EntryPointModule.INIT_FILE.equals(
                            p.getFileName().toString()))
                    .forEach(file -> {
                        final List<String> segments = segmentsOf(
                                packageDir, file);
                        if (isPrivate(segments)) {
                            LOG.debug("Skipping private module: {}", file);
                        } else {
                            modules.add(new EntryPointModule(packageName,
                                    segments, file));
                        }
                    });
        } catch (final UncheckedIOException e) {
            // raised while iterating, e.g. an unreadable subdirectory
            throw e.getCause();
        }

        modules.sort((a, b) -> ModulePathOrder.INSTANCE.compare(
                a.modulePath(), b.modulePath()));

        LOG.info("Found {} public entry points in {}", modules.size(),
                packageDir);
        return modules;
    }

    /** Returns the directory names between the package root and the file. */
    private static List<String> segmentsOf(final Path packageDir,
            final Path file) {
        final Path relativeDir = packageDir.relativize(file).getParent();
        final List<String> segments = new ArrayList<>();
        if (relativeDir != null) {
            for (final Path part : relativeDir) {
                segments.add(part.toString());
            }
        }
        return segments;
    }

    private static boolean isPrivate(final List<String> segments) {
        for (final String segment : segments) {
            if (segment.startsWith(PRIVATE_PREFIX)) {
                return true;
            }
        }
        return false;
    }

}
