package dtm.registry.core;

/**
 * Ordem de destruição dos objetos de um mesmo escopo.
 */
public enum TeardownOrder {
    /** O último registrado é o primeiro destruído. */
    REVERSE_REGISTRATION,
    /**
     * Dependentes são destruídos antes das suas dependências, usando as arestas
     * observadas durante a resolução. Empates seguem a ordem inversa de registro.
     */
    DEPENDENTS_FIRST
}
