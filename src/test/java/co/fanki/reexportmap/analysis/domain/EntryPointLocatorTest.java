package co.fanki.reexportmap.analysis.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for EntryPointLocator.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EntryPointLocatorTest {

    @TempDir
    Path sitePackages;

    @Test
    void whenLocating_givenPackageTree_shouldReturnPublicInitFilesSorted()
            throws IOException {
        touch("langchain/__init__.py");
        touch("langchain/schema/__init__.py");
        touch("langchain/agents/__init__.py");
        touch("langchain/agents/format_scratchpad/__init__.py");
        touch("langchain/agents/agent.py");
        touch("langchain/_api/__init__.py");
        touch("langchain/agents/_internal/__init__.py");
        touch("langchain/chat_models/base.py");

        final List<EntryPointModule> modules = new EntryPointLocator()
                .locate(sitePackages, "langchain");

        assertEquals(List.of(
                "langchain",
                "langchain.agents",
                "langchain.agents.format_scratchpad",
                "langchain.schema"),
                modules.stream().map(EntryPointModule::modulePath).toList());
        assertEquals("langchain/agents/format_scratchpad/__init__.py",
                modules.get(2).relativeFile());
        assertEquals(sitePackages.resolve(
                "langchain/agents/format_scratchpad/__init__.py"),
                modules.get(2).file());
    }

    @Test
    void whenLocating_givenMissingPackageDirectory_shouldReturnEmpty()
            throws IOException {
        assertTrue(new EntryPointLocator()
                .locate(sitePackages, "langchain").isEmpty());
    }

    @Test
    void whenLocating_givenOtherPackagesInRoot_shouldOnlyScanTheTarget()
            throws IOException {
        touch("langchain/__init__.py");
        touch("langchain_core/__init__.py");
        touch("langchain_core/tools/__init__.py");

        final List<EntryPointModule> modules = new EntryPointLocator()
                .locate(sitePackages, "langchain");

        assertEquals(1, modules.size());
        assertTrue(modules.get(0).segments().isEmpty());
    }

    private void touch(final String relative) throws IOException {
        final Path file = sitePackages.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

}
