package dtm.registry.prototypes;

import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.List;

/**
 * Descreve como a instância de um serviço é produzida.
 * <ul>
 *     <li>{@link InstanceSource} - objeto já construído, cuja posse passa ao registro;</li>
 *     <li>{@link TypeSource} - tipo construído pelo construtor padrão e depois injetado;</li>
 *     <li>{@link FunctionSource} - função que recebe as dependências resolvidas;</li>
 *     <li>{@link PluginSource} - plugin localizado por categoria e seletor, construído como tipo.</li>
 * </ul>
 */
public abstract class ServiceSource {

    public abstract Kind getKind();

    /**
     * Fontes que recebem injeção de propriedades depois de construídas.
     *
     * @return true para tipos e plugins
     */
    public boolean isPropertyInjected(){
        return getKind() == Kind.TYPE || getKind() == Kind.PLUGIN;
    }

    public static ServiceSource ofInstance(@NonNull Object instance){
        return new InstanceSource(instance);
    }

    public static ServiceSource ofType(@NonNull Class<?> type){
        return new TypeSource(type);
    }

    public static ServiceSource ofFunction(@NonNull ServiceFactory factory, ServiceKey... dependencies){
        return new FunctionSource(factory, List.of(dependencies));
    }

    public static ServiceSource ofFunction(@NonNull ServiceFactory factory, @NonNull List<ServiceKey> dependencies){
        return new FunctionSource(factory, List.copyOf(dependencies));
    }

    public static ServiceSource ofPlugin(@NonNull String category, String selector){
        return new PluginSource(category, selector);
    }

    public enum Kind {
        INSTANCE,
        TYPE,
        FUNCTION,
        PLUGIN
    }

    @Getter
    public static final class InstanceSource extends ServiceSource {
        private final Object instance;

        private InstanceSource(Object instance){
            this.instance = instance;
        }

        @Override
        public Kind getKind() {
            return Kind.INSTANCE;
        }

        @Override
        public String toString() {
            return "Instance[" + instance.getClass().getName() + "]";
        }
    }

    @Getter
    public static final class TypeSource extends ServiceSource {
        private final Class<?> type;

        private TypeSource(Class<?> type){
            this.type = type;
        }

        @Override
        public Kind getKind() {
            return Kind.TYPE;
        }

        @Override
        public String toString() {
            return "Type[" + type.getName() + "]";
        }
    }

    @Getter
    public static final class FunctionSource extends ServiceSource {
        private final ServiceFactory factory;
        private final List<ServiceKey> dependencies;

        private FunctionSource(ServiceFactory factory, List<ServiceKey> dependencies){
            this.factory = factory;
            this.dependencies = dependencies;
        }

        @Override
        public Kind getKind() {
            return Kind.FUNCTION;
        }

        @Override
        public String toString() {
            return "Function" + Arrays.toString(dependencies.toArray());
        }
    }

    @Getter
    public static final class PluginSource extends ServiceSource {
        private final String category;
        private final String selector;

        private PluginSource(String category, String selector){
            this.category = category;
            this.selector = (selector == null || selector.isEmpty()) ? null : selector;
        }

        @Override
        public Kind getKind() {
            return Kind.PLUGIN;
        }

        @Override
        public String toString() {
            return "Plugin[" + category + (selector == null ? "" : ":" + selector) + "]";
        }
    }
}
