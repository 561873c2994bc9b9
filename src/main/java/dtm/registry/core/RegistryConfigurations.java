package dtm.registry.core;

/**
 * Configurações do registro de serviços. Os métodos padrão definem os valores
 * usados quando nenhuma configuração é informada.
 */
public interface RegistryConfigurations {

    default TeardownOrder getTeardownOrder(){
        return TeardownOrder.REVERSE_REGISTRATION;
    }

    default boolean isPostConstructHooks(){
        return true;
    }

    /**
     * Pacote raiz sob o qual categorias relativas de plugin são procuradas.
     */
    default String getPluginRootPackage(){
        return "plugins";
    }

    /**
     * Se o registro deve se registrar (de forma fraca) sob a chave de {@link ServiceRegistry}.
     */
    default boolean isSelfRegistration(){
        return true;
    }
}
