package co.fanki.reexportmap.analysis.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for PackageVersionResolver.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PackageVersionResolverTest {

    @TempDir
    Path sitePackages;

    private PackageVersionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PackageVersionResolver();
    }

    @Test
    void whenResolving_givenConfiguredVersion_shouldUseIt() {
        assertEquals("0.2.0",
                resolver.resolve(sitePackages, "langchain", " 0.2.0 "));
    }

    @Test
    void whenResolving_givenDistInfoMetadata_shouldReadVersionHeader()
            throws IOException {
        distInfo("langchain-0.3.7.dist-info", """
                Metadata-Version: 2.1
                Name: langchain
                Version: 0.3.7.post1
                Summary: Building applications with LLMs

                Version: not-a-header
                """);

        assertEquals("0.3.7.post1",
                resolver.resolve(sitePackages, "langchain", ""));
    }

    @Test
    void whenResolving_givenUnnormalizedDistributionName_shouldMatch()
            throws IOException {
        distInfo("langchain_core-0.3.15.dist-info",
                "Name: langchain-core\nVersion: 0.3.15\n");
        distInfo("langchain-0.3.7.dist-info",
                "Name: langchain\nVersion: 0.3.7\n");

        assertEquals("0.3.15",
                resolver.resolve(sitePackages, "langchain-core", null));
        assertEquals("0.3.7",
                resolver.resolve(sitePackages, "langchain", null));
    }

    @Test
    void whenResolving_givenDistInfoWithoutMetadata_shouldUseDirectoryName()
            throws IOException {
        Files.createDirectories(sitePackages.resolve(
                "langchain-0.3.4.dist-info"));

        assertEquals("0.3.4",
                resolver.resolve(sitePackages, "langchain", ""));
    }

    @Test
    void whenResolving_givenNoDistribution_shouldReturnUnknown() {
        assertEquals(PackageVersionResolver.UNKNOWN_VERSION,
                resolver.resolve(sitePackages, "langchain", ""));
    }

    @Test
    void whenResolving_givenMissingRoot_shouldReturnUnknown() {
        assertEquals("latest", resolver.resolve(
                sitePackages.resolve("missing"), "langchain", ""));
    }

    @Test
    void whenNormalizing_givenSeparatorRuns_shouldCollapseThem() {
        assertEquals("langchain_core",
                PackageVersionResolver.normalize("LangChain-Core"));
        assertEquals("a_b", PackageVersionResolver.normalize("a._-b"));
    }

    private void distInfo(final String name, final String metadata)
            throws IOException {
        final Path dir = sitePackages.resolve(name);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("METADATA"), metadata);
    }

}
