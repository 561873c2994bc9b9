package dtm.registry.core;

import dtm.registry.exceptions.ServiceConstructionException;
import dtm.registry.prototypes.Registration;
import dtm.registry.prototypes.RegistrationState;
import dtm.registry.prototypes.Scope;
import dtm.registry.prototypes.ServiceKey;

import java.util.List;
import java.util.Optional;

/**
 * Interface responsável por fornecer acesso aos serviços registrados.
 *
 * Os serviços são construídos de forma preguiçosa na primeira resolução e mantidos
 * em cache até que o registro seja descartado ou o escopo destruído. As instâncias
 * devolvidas pertencem ao registro.
 */
public interface ServiceRegistryGetter {

    /**
     * Obtém o serviço registrado sob a chave, construindo-o se necessário.
     *
     * @param key chave do serviço
     * @return instância não nula
     * @throws ServiceConstructionException se não houver registro, se houver ciclo,
     *                                      ou se a construção falhar agora ou já tiver falhado
     */
    Object resolve(ServiceKey key) throws ServiceConstructionException;

    /**
     * Obtém o serviço registrado sob a chave e verifica o tipo.
     *
     * @throws ServiceConstructionException também quando a instância não é do tipo esperado
     */
    <T> T resolve(ServiceKey key, Class<T> type) throws ServiceConstructionException;

    /**
     * Obtém o serviço registrado sob a chave {@code ServiceKey.of(type)}.
     */
    <T> T resolve(Class<T> type) throws ServiceConstructionException;

    /**
     * Injeta serviços nos pontos de injeção do objeto, em ordem.
     * <p>
     * A injeção não é transacional: se um ponto falhar, os anteriores permanecem atribuídos
     * e o objeto deve ser considerado inutilizável.
     *
     * @param target objeto que receberá os serviços
     * @throws ServiceConstructionException se algum serviço não puder ser resolvido ou atribuído
     */
    void injectServices(Object target) throws ServiceConstructionException;

    /**
     * Cria uma nova instância pelo construtor padrão, injeta os serviços e a associa ao escopo dono.
     *
     * @param type  tipo concreto
     * @param owner escopo em cuja destruição o objeto será destruído; null deixa o objeto com quem chamou
     * @return nova instância injetada
     * @throws ServiceConstructionException se a construção ou a injeção falhar
     */
    <T> T constructInjected(Class<T> type, Scope owner) throws ServiceConstructionException;

    boolean contains(ServiceKey key);

    Optional<RegistrationState> stateOf(ServiceKey key);

    /**
     * @return registros ativos, na ordem em que foram registrados
     */
    List<Registration> getRegistrations();
}
