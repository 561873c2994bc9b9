package dtm.registry.storage;

import dtm.registry.prototypes.Registration;
import dtm.registry.prototypes.RegistrationState;
import dtm.registry.prototypes.Scope;
import dtm.registry.prototypes.ServiceKey;
import dtm.registry.prototypes.ServiceSource;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Registro mutável mantido pelo {@link ServiceRegistryStorage}.
 * <p>
 * O estado percorre {@code UNCONSTRUCTED -> CONSTRUCTING -> CONSTRUCTED} uma única vez,
 * ou termina em {@code FAILED}. Um novo registro na mesma chave cria outro descritor.
 */
@Getter
@ToString
public final class RegistrationDescriptor extends Registration {
    private final ServiceKey key;
    private final ServiceSource source;
    private final Scope scope;
    private final boolean weak;
    private final long sequence;
    private RegistrationState state;
    private boolean discarded;

    @ToString.Exclude
    private Object instance;

    @ToString.Exclude
    private Throwable failureCause;

    RegistrationDescriptor(@NonNull ServiceKey key, @NonNull ServiceSource source, @NonNull Scope scope, boolean weak, long sequence){
        this.key = key;
        this.source = source;
        this.scope = scope;
        this.weak = weak;
        this.sequence = sequence;
        this.state = RegistrationState.UNCONSTRUCTED;
    }

    void markConstructing(){
        requireState(RegistrationState.UNCONSTRUCTED, RegistrationState.CONSTRUCTING);
        this.state = RegistrationState.CONSTRUCTING;
    }

    void markConstructed(@NonNull Object instance){
        requireState(RegistrationState.CONSTRUCTING, RegistrationState.CONSTRUCTED);
        this.instance = instance;
        this.state = RegistrationState.CONSTRUCTED;
    }

    void markFailed(Throwable cause){
        requireState(RegistrationState.CONSTRUCTING, RegistrationState.FAILED);
        this.failureCause = cause;
        this.state = RegistrationState.FAILED;
    }

    /**
     * Entrega a instância que pertence ao registro para destruição e marca o descritor como descartado.
     * Um objeto de fonte {@code INSTANCE} pertence ao registro mesmo antes da primeira resolução.
     *
     * @return a instância possuída, ou null se não houver
     */
    Object releaseOwnedInstance(){
        if(discarded) return null;
        Object owned = null;
        if(state == RegistrationState.CONSTRUCTED){
            owned = instance;
        }else if(state == RegistrationState.UNCONSTRUCTED && source instanceof ServiceSource.InstanceSource instanceSource){
            owned = instanceSource.getInstance();
        }
        this.instance = null;
        this.discarded = true;
        return owned;
    }

    private void requireState(RegistrationState expected, RegistrationState next){
        if(state != expected){
            throw new IllegalStateException("Transição inválida de " + state + " para " + next + " no registro " + key);
        }
    }
}
