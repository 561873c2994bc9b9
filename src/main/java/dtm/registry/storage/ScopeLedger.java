package dtm.registry.storage;

import dtm.registry.prototypes.Scope;
import lombok.Getter;
import lombok.NonNull;

import java.util.*;

/**
 * Registro ordenado, por escopo, dos descritores e objetos associados que o escopo destrói.
 * A ordem de inserção é a base da ordem de destruição.
 */
final class ScopeLedger {
    private final Map<Scope, List<Entry>> entries = new LinkedHashMap<>();

    void record(@NonNull RegistrationDescriptor descriptor){
        entries.computeIfAbsent(descriptor.getScope(), s -> new ArrayList<>()).add(new Entry(descriptor, null));
    }

    void attach(@NonNull Scope scope, @NonNull Object instance){
        entries.computeIfAbsent(scope, s -> new ArrayList<>()).add(new Entry(null, instance));
    }

    void remove(@NonNull RegistrationDescriptor descriptor){
        List<Entry> scoped = entries.get(descriptor.getScope());
        if(scoped == null) return;
        scoped.removeIf(entry -> entry.getRegistration() == descriptor);
        if(scoped.isEmpty()){
            entries.remove(descriptor.getScope());
        }
    }

    /**
     * Remove o escopo e devolve suas entradas na ordem inversa de inserção.
     */
    List<Entry> drain(@NonNull Scope scope){
        List<Entry> scoped = entries.remove(scope);
        if(scoped == null) return List.of();
        List<Entry> reversed = new ArrayList<>(scoped);
        Collections.reverse(reversed);
        return reversed;
    }

    List<Scope> scopes(){
        return new ArrayList<>(entries.keySet());
    }

    @Getter
    static final class Entry {
        private final RegistrationDescriptor registration;
        private final Object attached;

        private Entry(RegistrationDescriptor registration, Object attached){
            this.registration = registration;
            this.attached = attached;
        }

        boolean isRegistration(){
            return registration != null;
        }
    }
}
