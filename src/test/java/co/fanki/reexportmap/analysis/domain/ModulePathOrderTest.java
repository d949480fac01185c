package co.fanki.reexportmap.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for ModulePathOrder.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ModulePathOrderTest {

    @Test
    void whenSorting_givenParentAndChildren_shouldPlaceParentFirst() {
        final List<String> paths = new ArrayList<>(List.of(
                "langchain.agents_extra",
                "langchain.agents.react",
                "langchain",
                "langchain.agents"));

        paths.sort(ModulePathOrder.INSTANCE);

        assertEquals(List.of(
                "langchain",
                "langchain.agents",
                "langchain.agents.react",
                "langchain.agents_extra"), paths);
    }

}
