package dtm.registry.prototypes;

/**
 * Visão somente leitura de um registro no {@code ServiceRegistry}.
 * <p>
 * Expõe a chave, a fonte, o escopo e o estado atual do registro. A instância
 * só existe enquanto o estado for {@link RegistrationState#CONSTRUCTED} e continua
 * pertencendo ao registro: quem a obtém não deve destruí-la.
 */
public abstract class Registration {
    public abstract ServiceKey getKey();
    public abstract ServiceSource getSource();
    public abstract Scope getScope();
    public abstract boolean isWeak();
    public abstract RegistrationState getState();
    public abstract Object getInstance();
    public abstract Throwable getFailureCause();
}
