package dtm.registry.prototypes;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Identidade sob a qual um serviço é registrado e resolvido.
 * <p>
 * Pode nomear um contrato (interface) ou um tipo concreto. Duas chaves são iguais
 * quando possuem o mesmo nome, portanto {@code ServiceKey.of(Logger.class)} e
 * {@code ServiceKey.of(Logger.class.getName())} endereçam o mesmo registro.
 */
@Getter
@EqualsAndHashCode
public final class ServiceKey implements Comparable<ServiceKey> {
    private final String name;

    private ServiceKey(String name){
        this.name = name;
    }

    public static ServiceKey of(@NonNull String name){
        if(name.isBlank()){
            throw new IllegalArgumentException("O nome da chave de serviço não pode ser vazio");
        }
        return new ServiceKey(name.strip());
    }

    public static ServiceKey of(@NonNull Class<?> type){
        return new ServiceKey(type.getName());
    }

    @Override
    public int compareTo(ServiceKey o) {
        return this.name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
