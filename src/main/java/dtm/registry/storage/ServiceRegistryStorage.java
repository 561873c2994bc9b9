package dtm.registry.storage;

import dtm.registry.core.*;
import dtm.registry.exceptions.ServiceConstructionException;
import dtm.registry.exceptions.ServiceConstructionException.Reason;
import dtm.registry.exceptions.ServiceExistsException;
import dtm.registry.exceptions.ServiceRegistryException;
import dtm.registry.prototypes.*;
import dtm.registry.sort.TopologicalSorter;
import dtm.registry.storage.metadata.ReflectiveTypeMetadata;
import dtm.registry.storage.plugin.ClassPathPluginLocator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Implementação padrão de {@link ServiceRegistry}.
 * <p>
 * Mantém um único mapa de chave para {@link RegistrationDescriptor} e, por escopo, a ordem
 * de registro usada na destruição. Registro, resolução e destruição são serializados por um
 * {@link ReentrantLock}: a resolução é recursiva e altera o estado dos descritores.
 * <p>
 * O registro possui toda instância que mantém em cache. Uma instância é destruída executando
 * seus métodos {@code @PreDestruction} e, em seguida, {@link AutoCloseable#close()} quando implementado.
 */
@Slf4j
public class ServiceRegistryStorage implements ServiceRegistry {
    private final Map<ServiceKey, RegistrationDescriptor> registrations;
    private final ScopeLedger ledger;
    private final ServiceResolver resolver;
    private final TypeMetadata typeMetadata;
    private final ReentrantLock lock;
    private long sequence;
    private volatile RegistryConfigurations configurations;

    public ServiceRegistryStorage(){
        this(RegistryConfigurationsStorage.defaults());
    }

    public ServiceRegistryStorage(@NonNull RegistryConfigurations configurations){
        this(configurations, null, null);
    }

    /**
     * @param configurations configurações do registro
     * @param typeMetadata   introspecção de tipos; null usa {@link ReflectiveTypeMetadata}
     * @param pluginLocator  localização de plugins; null usa {@link ClassPathPluginLocator} sob o pacote raiz configurado
     */
    public ServiceRegistryStorage(@NonNull RegistryConfigurations configurations, TypeMetadata typeMetadata, PluginLocator pluginLocator){
        this.configurations = RegistryConfigurationsStorage.copyOf(configurations);
        this.registrations = new HashMap<>();
        this.ledger = new ScopeLedger();
        this.lock = new ReentrantLock();
        this.typeMetadata = (typeMetadata != null) ? typeMetadata : new ReflectiveTypeMetadata(this);
        final PluginLocator locator = (pluginLocator != null)
                ? pluginLocator
                : new ClassPathPluginLocator(this.configurations.getPluginRootPackage());
        final Supplier<RegistryConfigurations> currentConfigurations = this::getConfigurations;
        this.resolver = new ServiceResolver(registrations, this.typeMetadata, locator, currentConfigurations, this::discardQuietly);

        if(this.configurations.isSelfRegistration()){
            selfRegistration();
        }
    }

    @Override
    public void register(@NonNull ServiceKey key, @NonNull ServiceSource source, @NonNull Scope scope, boolean weak) throws ServiceExistsException {
        lock.lock();
        try{
            final RegistrationDescriptor existing = registrations.get(key);
            if(existing != null){
                if(existing.getState() == RegistrationState.FAILED){
                    log.info("Registro de {} que falhou na construção substituído por {}", key, source);
                }else if(existing.isWeak()){
                    log.warn("Registro fraco de {} ({}) substituído por {}", key, existing.getSource(), source);
                }else{
                    throw new ServiceExistsException("Serviço já registrado para a chave: " + key, key);
                }
                discard(existing);
            }

            RegistrationDescriptor descriptor = new RegistrationDescriptor(key, source, scope, weak, ++sequence);
            registrations.put(key, descriptor);
            ledger.record(descriptor);
            log.debug("Serviço registrado: chave={}, fonte={}, escopo={}, fraco={}", key, source, scope, weak);
        }finally {
            lock.unlock();
        }
    }

    @Override
    public void unregister(@NonNull ServiceKey key) {
        lock.lock();
        try{
            final RegistrationDescriptor existing = registrations.get(key);
            if(existing == null) return;
            discard(existing);
            log.debug("Registro removido: {}", key);
        }finally {
            lock.unlock();
        }
    }

    @Override
    public Object resolve(@NonNull ServiceKey key) throws ServiceConstructionException {
        lock.lock();
        try{
            return resolver.resolve(key);
        }finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T resolve(@NonNull ServiceKey key, @NonNull Class<T> type) throws ServiceConstructionException {
        Object instance = resolve(key);
        if(!type.isInstance(instance)){
            throw new ServiceConstructionException(
                    "O serviço " + key + " (" + instance.getClass().getName() + ") não é do tipo " + type.getName(),
                    key,
                    Reason.TYPE_MISMATCH
            );
        }
        return type.cast(instance);
    }

    @Override
    public <T> T resolve(@NonNull Class<T> type) throws ServiceConstructionException {
        return resolve(ServiceKey.of(type), type);
    }

    @Override
    public void injectServices(@NonNull Object target) throws ServiceConstructionException {
        lock.lock();
        try{
            resolver.injectServices(target);
        }finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T constructInjected(@NonNull Class<T> type, Scope owner) throws ServiceConstructionException {
        lock.lock();
        try{
            final ServiceKey key = ServiceKey.of(type);
            final T instance;
            try{
                instance = typeMetadata.constructStandard(type);
            }catch (RuntimeException e){
                throw new ServiceConstructionException(
                        "Erro ao criar " + type.getName() + " ==> causa: " + e.getMessage(),
                        key,
                        Reason.CONSTRUCTION_FAILED,
                        e
                );
            }

            try{
                resolver.injectServices(instance);
            }catch (ServiceConstructionException e){
                discardQuietly(instance);
                throw e;
            }

            if(configurations.isPostConstructHooks()){
                try{
                    typeMetadata.invokePostConstructHook(instance);
                }catch (RuntimeException e){
                    discardQuietly(instance);
                    throw new ServiceConstructionException(
                            "Erro no gancho de pós-criação de " + type.getName() + " ==> causa: " + e.getMessage(),
                            key,
                            Reason.CONSTRUCTION_FAILED,
                            e
                    );
                }
            }

            if(owner != null){
                ledger.attach(owner, instance);
            }
            return instance;
        }finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(@NonNull ServiceKey key) {
        lock.lock();
        try{
            return registrations.containsKey(key);
        }finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<RegistrationState> stateOf(@NonNull ServiceKey key) {
        lock.lock();
        try{
            return Optional.ofNullable(registrations.get(key)).map(RegistrationDescriptor::getState);
        }finally {
            lock.unlock();
        }
    }

    @Override
    public List<Registration> getRegistrations() {
        lock.lock();
        try{
            return registrations.values().stream()
                    .sorted(Comparator.comparingLong(RegistrationDescriptor::getSequence))
                    .map(Registration.class::cast)
                    .collect(Collectors.toUnmodifiableList());
        }finally {
            lock.unlock();
        }
    }

    @Override
    public void teardownScope(@NonNull Scope scope) {
        lock.lock();
        try{
            final List<ScopeLedger.Entry> entries = orderForTeardown(ledger.drain(scope));
            if(entries.isEmpty()) return;
            log.debug("Destruindo escopo {} ({} objeto(s))", scope, entries.size());

            final List<Exception> failures = new ArrayList<>();
            for (ScopeLedger.Entry entry : entries){
                final Object owned;
                if(entry.isRegistration()){
                    RegistrationDescriptor descriptor = entry.getRegistration();
                    registrations.remove(descriptor.getKey(), descriptor);
                    resolver.forget(descriptor.getKey());
                    owned = descriptor.releaseOwnedInstance();
                }else{
                    owned = entry.getAttached();
                }

                try{
                    destroy(owned);
                }catch (Exception e){
                    log.error("Erro ao destruir {} no escopo {}", describe(entry), scope, e);
                    failures.add(e);
                }
            }

            if(!failures.isEmpty()){
                ServiceRegistryException exception = new ServiceRegistryException(
                        "Falha ao destruir " + failures.size() + " objeto(s) do escopo " + scope,
                        failures.get(0)
                );
                failures.stream().skip(1).forEach(exception::addSuppressed);
                throw exception;
            }
        }finally {
            lock.unlock();
        }
    }

    @Override
    public void teardownAll() {
        lock.lock();
        try{
            List<Scope> scopes = ledger.scopes();
            Collections.reverse(scopes);
            ServiceRegistryException first = null;
            for (Scope scope : scopes){
                try{
                    teardownScope(scope);
                }catch (ServiceRegistryException e){
                    if(first == null){
                        first = e;
                    }else{
                        first.addSuppressed(e);
                    }
                }
            }
            if(first != null) throw first;
        }finally {
            lock.unlock();
        }
    }

    @Override
    public List<Scope> getActiveScopes() {
        lock.lock();
        try{
            return ledger.scopes();
        }finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        teardownAll();
    }

    @Override
    public void enablePostConstructHooks() {
        this.configurations = RegistryConfigurationsStorage.copyOf(configurations).toBuilder()
                .postConstructHooks(true)
                .build();
    }

    @Override
    public void disablePostConstructHooks() {
        this.configurations = RegistryConfigurationsStorage.copyOf(configurations).toBuilder()
                .postConstructHooks(false)
                .build();
    }

    @Override
    public void setTeardownOrder(@NonNull TeardownOrder teardownOrder) {
        this.configurations = RegistryConfigurationsStorage.copyOf(configurations).toBuilder()
                .teardownOrder(teardownOrder)
                .build();
    }

    @Override
    public RegistryConfigurations getConfigurations() {
        return configurations;
    }

    private void selfRegistration(){
        register(ServiceKey.of(ServiceRegistry.class), ServiceSource.ofInstance(this), Scope.APPLICATION, true);
    }

    private void discard(RegistrationDescriptor descriptor){
        registrations.remove(descriptor.getKey(), descriptor);
        ledger.remove(descriptor);
        resolver.forget(descriptor.getKey());
        discardQuietly(descriptor.releaseOwnedInstance());
    }

    private void discardQuietly(Object instance){
        if(instance == null) return;
        try{
            destroy(instance);
        }catch (Exception e){
            log.error("Erro ao destruir a instância {}", instance.getClass().getName(), e);
        }
    }

    private void destroy(Object instance){
        if(instance == null || instance == this) return;
        typeMetadata.invokePreDestroyHook(instance);
        if(instance instanceof AutoCloseable closeable){
            try{
                closeable.close();
            }catch (RuntimeException e){
                throw e;
            }catch (Exception e){
                throw new ServiceRegistryException("Erro ao fechar " + instance.getClass().getName() + " ==> causa: " + e.getMessage(), e);
            }
        }
    }

    private List<ScopeLedger.Entry> orderForTeardown(List<ScopeLedger.Entry> newestFirst){
        if(configurations.getTeardownOrder() != TeardownOrder.DEPENDENTS_FIRST || newestFirst.size() < 2){
            return newestFirst;
        }

        final Map<ServiceKey, ScopeLedger.Entry> byKey = new LinkedHashMap<>();
        for (ScopeLedger.Entry entry : newestFirst){
            if(entry.isRegistration()){
                byKey.put(entry.getRegistration().getKey(), entry);
            }
        }

        // dependências antes dos dependentes; invertido, dependentes primeiro
        final Map<ServiceKey, Set<ServiceKey>> graph = resolver.getDependencyGraph();
        List<ServiceKey> keysOldestFirst = new ArrayList<>(byKey.keySet());
        Collections.reverse(keysOldestFirst);
        List<ServiceKey> sorted = TopologicalSorter.sort(keysOldestFirst, graph);
        Collections.reverse(sorted);

        // objetos associados dependem dos serviços, nunca o contrário
        final List<ScopeLedger.Entry> ordered = new ArrayList<>(newestFirst.size());
        for (ScopeLedger.Entry entry : newestFirst){
            if(!entry.isRegistration()){
                ordered.add(entry);
            }
        }
        for (ServiceKey key : sorted){
            ordered.add(byKey.get(key));
        }
        return ordered;
    }

    private String describe(ScopeLedger.Entry entry){
        if(entry.isRegistration()){
            return "o serviço " + entry.getRegistration().getKey();
        }
        return "o objeto " + entry.getAttached().getClass().getName();
    }
}
