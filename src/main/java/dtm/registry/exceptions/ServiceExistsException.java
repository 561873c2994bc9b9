package dtm.registry.exceptions;

import dtm.registry.prototypes.ServiceKey;
import lombok.Getter;

/**
 * Lançada quando um registro forte já ocupa a chave solicitada.
 * Nenhum estado do registro é alterado.
 */
@Getter
public class ServiceExistsException extends ServiceRegistryException{
    private final ServiceKey key;

    public ServiceExistsException(String message, ServiceKey key){
        super(message);
        this.key = key;
    }
}
