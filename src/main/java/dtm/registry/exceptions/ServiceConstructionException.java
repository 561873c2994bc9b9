package dtm.registry.exceptions;

import dtm.registry.prototypes.ServiceKey;
import lombok.Getter;

/**
 * Falha ao obter um serviço: chave sem registro, dependência circular,
 * erro na construção, na injeção ou em um registro que já falhou antes.
 */
@Getter
public class ServiceConstructionException extends ServiceRegistryException{
    private final ServiceKey key;
    private final Reason reason;

    public ServiceConstructionException(String message, ServiceKey key, Reason reason){
        super(message);
        this.key = key;
        this.reason = reason;
    }

    public ServiceConstructionException(String message, ServiceKey key, Reason reason, Throwable th){
        super(message, th);
        this.key = key;
        this.reason = reason;
    }

    /**
     * Verifica se esta exceção, ou alguma {@link ServiceConstructionException} na cadeia de causas,
     * possui o motivo informado.
     *
     * @param expected motivo procurado
     * @return true se algum elo da cadeia possuir o motivo
     */
    public boolean hasReason(Reason expected){
        Throwable current = this;
        while (current != null){
            if(current instanceof ServiceConstructionException construction && construction.reason == expected){
                return true;
            }
            if(current.getCause() == current) break;
            current = current.getCause();
        }
        return false;
    }

    public enum Reason {
        NOT_REGISTERED,
        CYCLE,
        CONSTRUCTION_FAILED,
        PREVIOUSLY_FAILED,
        INJECTION_FAILED,
        TYPE_MISMATCH
    }
}
