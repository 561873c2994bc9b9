package dtm.registry.sort;

import dtm.registry.exceptions.ServiceRegistryException;

import java.util.*;

public final class TopologicalSorter {

    private TopologicalSorter(){
        throw new IllegalStateException("utility class");
    }

    /**
     * Ordena os nós de forma que cada nó apareça depois de todas as suas dependências.
     * Nós sem relação entre si mantêm a ordem de iteração de {@code nodes}.
     * Dependências que não estão em {@code nodes} são ignoradas.
     *
     * @param nodes nós a ordenar
     * @param graph nó -> dependências do nó
     * @return lista com dependências antes dos dependentes
     * @throws ServiceRegistryException se houver ciclo entre os nós
     */
    public static <T> List<T> sort(Collection<T> nodes, Map<T, ? extends Collection<T>> graph) {
        Set<T> members = new LinkedHashSet<>(nodes);
        List<T> ordered = new ArrayList<>();
        Set<T> visited = new HashSet<>();
        Set<T> visiting = new HashSet<>();

        for (T node : members) {
            if (!visited.contains(node)) {
                topologicalSortVisit(node, graph, members, visited, visiting, ordered);
            }
        }

        return ordered;
    }

    private static <T> void topologicalSortVisit(T node,
                                      Map<T, ? extends Collection<T>> graph,
                                      Set<T> members,
                                      Set<T> visited,
                                      Set<T> visiting,
                                      List<T> ordered) {
        if (visiting.contains(node)) {
            throw new ServiceRegistryException("Ciclo de dependência detectado em: " + node);
        }

        if (visited.contains(node)) return;

        visiting.add(node);

        Collection<T> deps = graph.get(node);
        if (deps != null) {
            for (T dep : deps) {
                if (members.contains(dep)) {
                    topologicalSortVisit(dep, graph, members, visited, visiting, ordered);
                }
            }
        }

        visiting.remove(node);
        visited.add(node);
        ordered.add(node);
    }

}
