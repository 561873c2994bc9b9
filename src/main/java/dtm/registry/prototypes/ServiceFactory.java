package dtm.registry.prototypes;

/**
 * Função de criação de um serviço. Recebe as dependências já resolvidas,
 * na ordem em que foram declaradas no registro.
 */
@FunctionalInterface
public interface ServiceFactory {
    Object create(Object[] dependencies) throws Exception;
}
