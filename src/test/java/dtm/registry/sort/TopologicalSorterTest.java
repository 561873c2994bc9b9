package dtm.registry.sort;

import dtm.registry.exceptions.ServiceRegistryException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TopologicalSorterTest {

    @Test
    void dependenciesComeBeforeDependents() {
        Map<String, Set<String>> graph = Map.of(
                "app", Set.of("mailer"),
                "mailer", Set.of("logger")
        );

        List<String> ordered = TopologicalSorter.sort(List.of("app", "mailer", "logger"), graph);

        assertEquals(List.of("logger", "mailer", "app"), ordered);
    }

    @Test
    void unrelatedNodesKeepInputOrder() {
        assertEquals(List.of("c", "a", "b"), TopologicalSorter.sort(List.of("c", "a", "b"), Map.of()));
    }

    @Test
    void dependenciesOutsideTheInputAreIgnored() {
        Map<String, Set<String>> graph = Map.of("a", Set.of("external"));
        assertEquals(List.of("a"), TopologicalSorter.sort(List.of("a"), graph));
    }

    @Test
    void nodesWithoutEntryInTheGraphHaveNoDependencies() {
        Map<String, List<String>> graph = Map.of("mailer", List.of("logger"));

        assertEquals(List.of("app", "logger", "mailer"),
                TopologicalSorter.sort(List.of("app", "mailer", "logger"), graph));
    }

    @Test
    void cyclesAreRejected() {
        Map<String, Set<String>> graph = Map.of(
                "a", Set.of("b"),
                "b", Set.of("a")
        );
        assertThrows(ServiceRegistryException.class, () -> TopologicalSorter.sort(List.of("a", "b"), graph));
    }
}
