package dtm.registry.prototypes;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Ponto de injeção declarado por um tipo: a chave do serviço desejado
 * e a forma de atribuí-lo ao objeto alvo.
 */
@Getter
@ToString
@AllArgsConstructor
public final class InjectionSlot {
    @NonNull
    private final ServiceKey key;
    @NonNull
    private final String name;
    @NonNull
    @ToString.Exclude
    private final Setter setter;

    public void apply(Object target, Object value) throws Exception {
        setter.set(target, value);
    }

    @FunctionalInterface
    public interface Setter {
        void set(Object target, Object value) throws Exception;
    }
}
