package dtm.registry.storage;

import dtm.registry.core.PluginLocator;
import dtm.registry.core.RegistryConfigurations;
import dtm.registry.core.TypeMetadata;
import dtm.registry.exceptions.ServiceConstructionException;
import dtm.registry.exceptions.ServiceConstructionException.Reason;
import dtm.registry.prototypes.InjectionSlot;
import dtm.registry.prototypes.ServiceKey;
import dtm.registry.prototypes.ServiceSource;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Construção preguiçosa dos serviços registrados.
 * <p>
 * Cada resolução consulta o descritor da chave: instâncias em cache são devolvidas,
 * um descritor em {@code CONSTRUCTING} indica dependência circular e um descritor em
 * {@code FAILED} falha de novo sem repetir a construção. As arestas de dependência
 * observadas durante a construção são guardadas para a destruição ordenada.
 * <p>
 * Não é thread-safe; o {@link ServiceRegistryStorage} serializa o acesso.
 */
@Slf4j
final class ServiceResolver {
    private final Map<ServiceKey, RegistrationDescriptor> registrations;
    private final TypeMetadata typeMetadata;
    private final PluginLocator pluginLocator;
    private final Supplier<RegistryConfigurations> configurations;
    private final Consumer<Object> discarder;
    private final Deque<ServiceKey> constructionStack;
    private final Map<ServiceKey, Set<ServiceKey>> dependencyGraph;

    ServiceResolver(
            @NonNull Map<ServiceKey, RegistrationDescriptor> registrations,
            @NonNull TypeMetadata typeMetadata,
            @NonNull PluginLocator pluginLocator,
            @NonNull Supplier<RegistryConfigurations> configurations,
            @NonNull Consumer<Object> discarder
    ){
        this.registrations = registrations;
        this.typeMetadata = typeMetadata;
        this.pluginLocator = pluginLocator;
        this.configurations = configurations;
        this.discarder = discarder;
        this.constructionStack = new ArrayDeque<>();
        this.dependencyGraph = new HashMap<>();
    }

    Object resolve(@NonNull ServiceKey key) throws ServiceConstructionException {
        final RegistrationDescriptor descriptor = registrations.get(key);
        if(descriptor == null){
            throw new ServiceConstructionException("Nenhum serviço registrado para: " + key, key, Reason.NOT_REGISTERED);
        }

        switch (descriptor.getState()){
            case CONSTRUCTED:
                recordEdge(key);
                return descriptor.getInstance();
            case CONSTRUCTING:
                throw new ServiceConstructionException("Dependência circular detectada: " + describeCycle(key), key, Reason.CYCLE);
            case FAILED:
                throw new ServiceConstructionException(
                        "O serviço " + key + " falhou anteriormente e precisa ser registrado de novo",
                        key,
                        Reason.PREVIOUSLY_FAILED,
                        descriptor.getFailureCause()
                );
            default:
                break;
        }

        Object instance = construct(descriptor);
        recordEdge(key);
        return instance;
    }

    void injectServices(@NonNull Object target) throws ServiceConstructionException {
        final Class<?> clazz = target.getClass();
        final List<InjectionSlot> slots;
        try{
            slots = typeMetadata.injectableSlots(clazz);
        }catch (RuntimeException e){
            throw new ServiceConstructionException(
                    "Não foi possível obter os pontos de injeção de " + clazz.getName() + " ==> causa: " + e.getMessage(),
                    ServiceKey.of(clazz),
                    Reason.INJECTION_FAILED,
                    e
            );
        }

        for (InjectionSlot slot : slots){
            try{
                Object service = resolve(slot.getKey());
                slot.apply(target, service);
            }catch (Exception e){
                throw new ServiceConstructionException(
                        "Erro ao injetar '" + slot.getName() + "' em " + clazz.getName() + " ==> causa: " + e.getMessage(),
                        slot.getKey(),
                        Reason.INJECTION_FAILED,
                        e
                );
            }
        }
    }

    /**
     * @return cópia das arestas dependente -> dependências observadas até agora
     */
    Map<ServiceKey, Set<ServiceKey>> getDependencyGraph(){
        Map<ServiceKey, Set<ServiceKey>> copy = new HashMap<>();
        dependencyGraph.forEach((key, deps) -> copy.put(key, new LinkedHashSet<>(deps)));
        return copy;
    }

    void forget(@NonNull ServiceKey key){
        dependencyGraph.remove(key);
        dependencyGraph.values().forEach(deps -> deps.remove(key));
    }

    private Object construct(RegistrationDescriptor descriptor){
        final ServiceKey key = descriptor.getKey();
        descriptor.markConstructing();
        constructionStack.push(key);
        log.debug("Construindo serviço {} a partir de {}", key, descriptor.getSource());

        Object instance = null;
        try{
            instance = produce(descriptor);
            if(descriptor.getSource().isPropertyInjected()){
                injectServices(instance);
            }
            if(configurations.get().isPostConstructHooks()){
                typeMetadata.invokePostConstructHook(instance);
            }
            // removido ou substituído durante a própria construção: a instância não tem dono
            if(descriptor.isDiscarded()){
                throw new IllegalStateException("O registro de " + key + " foi descartado durante a construção");
            }
            descriptor.markConstructed(instance);
            return instance;
        }catch (Exception e){
            descriptor.markFailed(e);
            dependencyGraph.remove(key);
            if(instance != null){
                discarder.accept(instance);
            }
            log.debug("Falha ao construir o serviço {}: {}", key, e.getMessage());
            throw new ServiceConstructionException(
                    "Erro ao construir o serviço: " + key + " ==> causa: " + e.getMessage(),
                    key,
                    Reason.CONSTRUCTION_FAILED,
                    e
            );
        }finally {
            constructionStack.pop();
        }
    }

    private Object produce(RegistrationDescriptor descriptor) throws Exception {
        final ServiceSource source = descriptor.getSource();

        if(source instanceof ServiceSource.InstanceSource instanceSource){
            return instanceSource.getInstance();
        }

        if(source instanceof ServiceSource.TypeSource typeSource){
            return typeMetadata.constructStandard(typeSource.getType());
        }

        if(source instanceof ServiceSource.FunctionSource functionSource){
            final List<ServiceKey> dependencies = functionSource.getDependencies();
            final Object[] args = new Object[dependencies.size()];
            for (int i = 0; i < args.length; i++){
                args[i] = resolve(dependencies.get(i));
            }
            Object instance = functionSource.getFactory().create(args);
            if(instance == null){
                throw new NullPointerException("A função de criação devolveu null para " + descriptor.getKey());
            }
            return instance;
        }

        if(source instanceof ServiceSource.PluginSource pluginSource){
            Class<?> pluginType = pluginLocator.resolvePlugin(pluginSource.getCategory(), pluginSource.getSelector());
            log.debug("Plugin {} resolvido para {}", pluginSource, pluginType.getName());
            return typeMetadata.constructStandard(pluginType);
        }

        throw new IllegalStateException("Fonte de serviço desconhecida: " + source);
    }

    private void recordEdge(ServiceKey dependency){
        final ServiceKey dependent = constructionStack.peek();
        if(dependent != null && !dependent.equals(dependency)){
            dependencyGraph.computeIfAbsent(dependent, k -> new LinkedHashSet<>()).add(dependency);
        }
    }

    private String describeCycle(ServiceKey key){
        List<ServiceKey> path = new ArrayList<>(constructionStack);
        Collections.reverse(path);
        int start = path.indexOf(key);
        List<ServiceKey> cycle = new ArrayList<>(start >= 0 ? path.subList(start, path.size()) : path);
        cycle.add(key);
        return cycle.stream().map(ServiceKey::toString).collect(Collectors.joining(" -> "));
    }
}
