package dtm.registry.core;

import dtm.registry.prototypes.Scope;

import java.util.List;

/**
 * Interface principal do registro de serviços.
 *
 * Estende as interfaces:
 * <ul>
 *   <li>{@link ServiceRegistryGetter} - resolução e injeção;</li>
 *   <li>{@link ServiceRegistryRegistor} - registro e remoção;</li>
 *   <li>{@link ServiceRegistryConfigurator} - configuração.</li>
 * </ul>
 *
 * O registro não é global: cada instância é criada explicitamente pelo contexto dono
 * (por exemplo, no início da aplicação) e deve ser fechada por ele ao final.
 */
public interface ServiceRegistry extends
        ServiceRegistryGetter,
        ServiceRegistryRegistor,
        ServiceRegistryConfigurator,
        AutoCloseable
{
    /**
     * Destrói todas as instâncias do escopo e remove seus registros.
     *
     * @param scope escopo a destruir
     */
    void teardownScope(Scope scope);

    /**
     * Destrói todos os escopos, na ordem inversa do primeiro uso de cada um.
     */
    void teardownAll();

    /**
     * @return escopos com registros ou objetos associados, na ordem do primeiro uso
     */
    List<Scope> getActiveScopes();

    @Override
    void close();
}
