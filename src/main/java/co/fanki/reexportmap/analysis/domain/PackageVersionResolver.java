package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads the version of an installed Python distribution.
 *
 * <p>Looks for a {@code <name>-<version>.dist-info} directory next to the
 * package, as left by {@code pip install --target}, and reads the
 * {@code Version:} header of its {@code METADATA} file. Distribution names
 * are compared in normalized form, so {@code langchain-core} and
 * {@code langchain_core} are the same distribution.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PackageVersionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            PackageVersionResolver.class);

    /** Reported when no version can be determined. */
    public static final String UNKNOWN_VERSION = "latest";

    private static final String DIST_INFO_SUFFIX = ".dist-info";

    private static final String VERSION_HEADER = "Version:";

    /**
     * Resolves the version of a distribution.
     *
     * @param sourceRoot the directory the distribution is installed in
     * @param distribution the distribution name, e.g. "langchain-core"
     * @param configured an explicit version, used when not blank
     * @return the version, or {@link #UNKNOWN_VERSION}
     */
    public String resolve(final Path sourceRoot, final String distribution,
            final String configured) {
        Preconditions.requireNonBlank(distribution,
                "Distribution name is required");

        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        if (sourceRoot == null || !Files.isDirectory(sourceRoot)) {
            LOG.warn("Cannot resolve version of {}: {} is not a directory",
                    distribution, sourceRoot);
            return UNKNOWN_VERSION;
        }

        final String wanted = normalize(distribution);
        final List<Path> candidates;
        try (Stream<Path> children = Files.list(sourceRoot)) {
            candidates = children
                    .filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString()
                            .endsWith(DIST_INFO_SUFFIX))
                    .filter(p -> wanted.equals(normalize(
                            distributionOf(p.getFileName().toString()))))
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            LOG.warn("Error listing {}: {}", sourceRoot, e.getMessage());
            return UNKNOWN_VERSION;
        }

        if (candidates.isEmpty()) {
            LOG.warn("No installed distribution metadata found for {} in {}",
                    distribution, sourceRoot);
            return UNKNOWN_VERSION;
        }
        if (candidates.size() > 1) {
            LOG.warn("Several installed versions of {} found, using {}",
                    distribution, candidates.get(0).getFileName());
        }

        final Path distInfo = candidates.get(0);
        final String version = readMetadataVersion(distInfo);
        if (version != null) {
            return version;
        }
        return versionOf(distInfo.getFileName().toString());
    }

    /**
     * Normalizes a distribution name: lower case, with runs of
     * {@code -}, {@code _} and {@code .} replaced by a single underscore.
     *
     * @param name the distribution name
     * @return the normalized name
     */
    static String normalize(final String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[-_.]+", "_");
    }

    private static String readMetadataVersion(final Path distInfo) {
        final Path metadata = distInfo.resolve("METADATA");
        if (!Files.isRegularFile(metadata)) {
            return null;
        }
        try {
            for (final String line : Files.readAllLines(metadata)) {
                if (line.isEmpty()) {
                    // headers end at the first blank line
                    return null;
                }
                if (line.startsWith(VERSION_HEADER)) {
                    final String version = line.substring(
                            VERSION_HEADER.length()).trim();
                    return version.isEmpty() ? null : version;
                }
            }
        } catch (final IOException e) {
            LOG.warn("Error reading {}: {}", metadata, e.getMessage());
        }
        return null;
    }

    /** Returns "name" from "name-1.0.dist-info". */
    private static String distributionOf(final String dirName) {
        final String base = dirName.substring(0,
                dirName.length() - DIST_INFO_SUFFIX.length());
        final int dash = base.indexOf('-');
        return dash < 0 ? base : base.substring(0, dash);
    }

    /** Returns "1.0" from "name-1.0.dist-info". */
    private static String versionOf(final String dirName) {
        final String base = dirName.substring(0,
                dirName.length() - DIST_INFO_SUFFIX.length());
        final int dash = base.indexOf('-');
        return dash < 0 ? UNKNOWN_VERSION : base.substring(dash + 1);
    }

}
