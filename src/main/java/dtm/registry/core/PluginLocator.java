package dtm.registry.core;

import dtm.registry.exceptions.PluginNotFoundException;

/**
 * Resolve um par (categoria, seletor) para um tipo de plugin construível.
 */
public interface PluginLocator {

    /**
     * @param category caminho de agrupamento, pesquisado de forma não recursiva
     * @param selector chave de metadado do plugin; null escolhe um candidato qualquer
     * @return tipo concreto do plugin
     * @throws PluginNotFoundException se nenhum candidato corresponder
     */
    Class<?> resolvePlugin(String category, String selector) throws PluginNotFoundException;
}
