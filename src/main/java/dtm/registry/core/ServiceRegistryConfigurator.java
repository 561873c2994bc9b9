package dtm.registry.core;

/**
 * Interface para configuração do comportamento do registro.
 */
public interface ServiceRegistryConfigurator {

    /**
     * Habilita a execução dos métodos {@code @PostCreation} após a construção.
     */
    void enablePostConstructHooks();
    /**
     * Desabilita a execução dos métodos {@code @PostCreation}.
     */
    void disablePostConstructHooks();

    void setTeardownOrder(TeardownOrder teardownOrder);

    RegistryConfigurations getConfigurations();
}
