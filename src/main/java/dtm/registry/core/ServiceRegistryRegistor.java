package dtm.registry.core;

import dtm.registry.exceptions.ServiceExistsException;
import dtm.registry.prototypes.Scope;
import dtm.registry.prototypes.ServiceFactory;
import dtm.registry.prototypes.ServiceKey;
import dtm.registry.prototypes.ServiceSource;
import lombok.NonNull;

/**
 * Interface para registro e remoção de serviços.
 *
 * Um registro fraco é um padrão substituível: qualquer registro posterior na mesma
 * chave o descarta, destruindo a instância em cache. Um registro forte trava a chave
 * e faz qualquer registro posterior falhar com {@link ServiceExistsException}.
 * Um registro que falhou na construção não trava a chave: registrar de novo é a forma de recuperá-lo.
 */
public interface ServiceRegistryRegistor {

    /**
     * Registra um serviço.
     *
     * @param key    chave do serviço
     * @param source forma de produção da instância
     * @param scope  escopo de destruição
     * @param weak   true para um registro substituível
     * @throws ServiceExistsException se um registro forte já ocupar a chave
     */
    void register(ServiceKey key, ServiceSource source, Scope scope, boolean weak) throws ServiceExistsException;

    /**
     * Destrói a instância (se houver) e remove o registro da chave. Não faz nada se a chave estiver livre.
     *
     * @param key chave do serviço
     */
    void unregister(ServiceKey key);

    default void registerInstance(@NonNull ServiceKey key, @NonNull Object instance) throws ServiceExistsException{
        register(key, ServiceSource.ofInstance(instance), Scope.APPLICATION, false);
    }

    default void registerType(@NonNull ServiceKey key, @NonNull Class<?> type) throws ServiceExistsException{
        register(key, ServiceSource.ofType(type), Scope.APPLICATION, false);
    }

    default void registerType(@NonNull Class<?> type) throws ServiceExistsException{
        registerType(ServiceKey.of(type), type);
    }

    default void registerFactory(@NonNull ServiceKey key, @NonNull ServiceFactory factory, ServiceKey... dependencies) throws ServiceExistsException{
        register(key, ServiceSource.ofFunction(factory, dependencies), Scope.APPLICATION, false);
    }

    default void registerPlugin(@NonNull ServiceKey key, @NonNull String category, String selector) throws ServiceExistsException{
        register(key, ServiceSource.ofPlugin(category, selector), Scope.APPLICATION, false);
    }
}
