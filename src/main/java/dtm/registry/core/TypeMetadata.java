package dtm.registry.core;

import dtm.registry.exceptions.TypeMetadataException;
import dtm.registry.prototypes.InjectionSlot;

import java.util.List;

/**
 * Capacidade de introspecção de tipos usada pelo registro.
 *
 * O registro nunca inspeciona classes diretamente: construção, pontos de injeção
 * e ganchos de ciclo de vida passam por esta interface, fornecida pelo ambiente.
 */
public interface TypeMetadata {

    /**
     * Invoca o construtor padrão do tipo.
     *
     * @param type tipo concreto
     * @return nova instância, nunca null
     * @throws TypeMetadataException se o tipo não possuir construtor utilizável ou se o construtor falhar
     */
    <T> T constructStandard(Class<T> type) throws TypeMetadataException;

    /**
     * Enumera os pontos de injeção declarados pelo tipo, na ordem em que devem ser aplicados.
     *
     * @param type tipo inspecionado
     * @return lista, possivelmente vazia
     * @throws TypeMetadataException se algum ponto de injeção for inválido
     */
    List<InjectionSlot> injectableSlots(Class<?> type) throws TypeMetadataException;

    /**
     * Executa os ganchos de pós-criação, se existirem.
     *
     * @param instance instância já injetada
     * @throws TypeMetadataException se algum gancho falhar
     */
    void invokePostConstructHook(Object instance) throws TypeMetadataException;

    /**
     * Executa os ganchos de pré-destruição, se existirem.
     *
     * @param instance instância que será descartada
     * @throws TypeMetadataException se algum gancho falhar
     */
    void invokePreDestroyHook(Object instance) throws TypeMetadataException;
}
