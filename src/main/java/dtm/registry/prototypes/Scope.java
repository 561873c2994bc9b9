package dtm.registry.prototypes;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Fase de destruição. Cada registro pertence a exatamente um escopo e
 * é destruído junto com ele.
 */
@Getter
@EqualsAndHashCode
public final class Scope {
    public static final Scope APPLICATION = new Scope("application");
    public static final Scope TRANSIENT = new Scope("transient");

    private final String name;

    private Scope(String name){
        this.name = name;
    }

    public static Scope of(@NonNull String name){
        if(name.isBlank()){
            throw new IllegalArgumentException("O nome do escopo não pode ser vazio");
        }
        return new Scope(name.strip());
    }

    @Override
    public String toString() {
        return name;
    }
}
