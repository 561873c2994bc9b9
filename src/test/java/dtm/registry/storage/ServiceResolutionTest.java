package dtm.registry.storage;

import dtm.registry.exceptions.ServiceConstructionException;
import dtm.registry.exceptions.ServiceConstructionException.Reason;
import dtm.registry.exceptions.TypeMetadataException;
import dtm.registry.fixtures.*;
import dtm.registry.fixtures.codecs.GzipCodec;
import dtm.registry.fixtures.codecs.PlainCodec;
import dtm.registry.prototypes.RegistrationState;
import dtm.registry.prototypes.Scope;
import dtm.registry.prototypes.ServiceKey;
import dtm.registry.prototypes.ServiceSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ServiceResolutionTest {
    private static final ServiceKey LOGGER = ServiceKey.of(Logger.class);
    private static final ServiceKey JOURNAL = ServiceKey.of(Journal.class);

    private ServiceRegistryStorage registry;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistryStorage(RegistryConfigurationsStorage.builder()
                .pluginRootPackage("dtm.registry.fixtures")
                .build());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("Duas resoluções devolvem a mesma instância e o gancho roda uma única vez")
    void resolutionIsIdempotent() {
        registry.register(LOGGER, ServiceSource.ofType(ConsoleLogger.class), Scope.APPLICATION, false);

        Object first = registry.resolve(LOGGER);
        Object second = registry.resolve(LOGGER);

        assertSame(first, second);
        assertEquals(1, ((ConsoleLogger) first).getPostCreationCount());
        assertEquals(RegistrationState.CONSTRUCTED, registry.stateOf(LOGGER).orElseThrow());
    }

    @Test
    @DisplayName("Nada é construído no registro, apenas na primeira resolução")
    void servicesAreLazy() {
        AtomicInteger calls = new AtomicInteger();
        registry.registerFactory(ServiceKey.of("lazy"), args -> {
            calls.incrementAndGet();
            return "valor";
        });

        assertEquals(0, calls.get());
        assertEquals(RegistrationState.UNCONSTRUCTED, registry.stateOf(ServiceKey.of("lazy")).orElseThrow());

        registry.resolve(ServiceKey.of("lazy"));
        registry.resolve(ServiceKey.of("lazy"));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Fábrica recebe as dependências resolvidas na ordem declarada")
    void functionFactoryReceivesDependenciesInOrder() {
        List<String> resolutionOrder = new ArrayList<>();
        registry.registerFactory(ServiceKey.of("first"), args -> {
            resolutionOrder.add("first");
            return "1";
        });
        registry.registerFactory(ServiceKey.of("second"), args -> {
            resolutionOrder.add("second");
            return "2";
        });
        registry.registerFactory(ServiceKey.of("joined"),
                args -> String.join("+", (String) args[1], (String) args[0]),
                ServiceKey.of("second"), ServiceKey.of("first"));

        assertEquals("1+2", registry.resolve(ServiceKey.of("joined")));
        assertEquals(List.of("second", "first"), resolutionOrder);
    }

    @Test
    @DisplayName("Fábrica que falha deixa o registro em FAILED e não é chamada de novo")
    void failingFactoryIsSticky() {
        AtomicInteger calls = new AtomicInteger();
        registry.registerType(LOGGER, ConsoleLogger.class);
        registry.registerFactory(ServiceKey.of("X"), args -> {
            calls.incrementAndGet();
            throw new IllegalStateException("fábrica quebrada");
        }, LOGGER);

        ServiceConstructionException first = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(ServiceKey.of("X")));
        assertEquals(Reason.CONSTRUCTION_FAILED, first.getReason());
        assertInstanceOf(IllegalStateException.class, first.getCause());
        assertEquals(RegistrationState.FAILED, registry.stateOf(ServiceKey.of("X")).orElseThrow());

        ServiceConstructionException second = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(ServiceKey.of("X")));
        assertEquals(Reason.PREVIOUSLY_FAILED, second.getReason());
        assertSame(first.getCause(), second.getCause());
        assertEquals(1, calls.get());
        assertEquals(RegistrationState.CONSTRUCTED, registry.stateOf(LOGGER).orElseThrow());
    }

    @Test
    @DisplayName("Dependência circular entre fábricas falha em vez de recursão infinita")
    void mutualDependencyIsDetected() {
        ServiceKey a = ServiceKey.of("A");
        ServiceKey b = ServiceKey.of("B");
        registry.registerFactory(a, args -> "a", b);
        registry.registerFactory(b, args -> "b", a);

        ServiceConstructionException error = assertThrows(ServiceConstructionException.class, () -> registry.resolve(a));

        assertTrue(error.hasReason(Reason.CYCLE));
        assertTrue(error.getMessage().contains("B"));
        assertEquals(RegistrationState.FAILED, registry.stateOf(a).orElseThrow());
        assertEquals(RegistrationState.FAILED, registry.stateOf(b).orElseThrow());
    }

    @Test
    void selfDependencyIsACycle() {
        ServiceKey self = ServiceKey.of("self");
        registry.registerFactory(self, args -> "never", self);

        ServiceConstructionException error = assertThrows(ServiceConstructionException.class, () -> registry.resolve(self));
        assertTrue(error.hasReason(Reason.CYCLE));
        assertFalse(error.hasReason(Reason.NOT_REGISTERED));
    }

    @Test
    void missingKeyIsNotRegistered() {
        ServiceConstructionException error = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(ServiceKey.of("nobody")));
        assertEquals(Reason.NOT_REGISTERED, error.getReason());
        assertEquals(ServiceKey.of("nobody"), error.getKey());
    }

    @Test
    void missingDependencyFailsTheDependent() {
        registry.registerFactory(ServiceKey.of("needs"), args -> "x", ServiceKey.of("absent"));

        ServiceConstructionException error = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(ServiceKey.of("needs")));
        assertEquals(Reason.CONSTRUCTION_FAILED, error.getReason());
        assertTrue(error.hasReason(Reason.NOT_REGISTERED));
    }

    @Test
    void factoryReturningNullFails() {
        registry.registerFactory(ServiceKey.of("null"), args -> null);

        assertThrows(ServiceConstructionException.class, () -> registry.resolve(ServiceKey.of("null")));
        assertEquals(RegistrationState.FAILED, registry.stateOf(ServiceKey.of("null")).orElseThrow());
    }

    @Test
    void failingConstructorIsReportedWithItsCause() {
        registry.registerType(Broken.class);

        ServiceConstructionException error = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(Broken.class));

        TypeMetadataException metadata = assertInstanceOf(TypeMetadataException.class, error.getCause());
        assertEquals(Broken.class, metadata.getReferenceClass());
        assertEquals("boom", metadata.getCause().getMessage());
    }

    @Test
    @DisplayName("Tipos recebem injeção de propriedades antes do gancho de pós-criação")
    void typeSourcesArePropertyInjected() {
        registry.registerType(LOGGER, ConsoleLogger.class);
        registry.registerInstance(JOURNAL, new Journal());
        registry.registerType(Mailer.class);

        Mailer mailer = registry.resolve(Mailer.class);

        assertSame(registry.resolve(LOGGER), mailer.getLogger());
        assertSame(registry.resolve(JOURNAL), mailer.getJournal());
        assertEquals(List.of("mailer pronto"), mailer.getLogger().getLines());
    }

    @Test
    @DisplayName("Objetos de fonte INSTANCE e FUNCTION não recebem injeção de propriedades")
    void instanceAndFunctionSourcesAreNotInjected() {
        registry.registerInstance(JOURNAL, new Journal());
        registry.registerInstance(ServiceKey.of("provided"), new PartiallyInjectable());
        registry.registerFactory(ServiceKey.of("built"), args -> new PartiallyInjectable());

        PartiallyInjectable provided = registry.resolve(ServiceKey.of("provided"), PartiallyInjectable.class);
        PartiallyInjectable built = registry.resolve(ServiceKey.of("built"), PartiallyInjectable.class);

        assertNull(provided.getJournal());
        assertNull(built.getJournal());
    }

    @Test
    void failedPropertyInjectionFailsTheService() {
        registry.registerType(Mailer.class);

        ServiceConstructionException error = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(Mailer.class));
        assertTrue(error.hasReason(Reason.INJECTION_FAILED));
        assertEquals(RegistrationState.FAILED, registry.stateOf(ServiceKey.of(Mailer.class)).orElseThrow());
    }

    @Test
    void failingHookDestroysTheInstanceAndFails() {
        Journal journal = new Journal();
        registry.registerFactory(ServiceKey.of("tracked"), args -> new Tracked("t", journal) {
            @dtm.registry.annotations.PostCreation(order = 1)
            void explode(){
                throw new IllegalStateException("gancho falhou");
            }
        });

        assertThrows(ServiceConstructionException.class, () -> registry.resolve(ServiceKey.of("tracked")));
        assertEquals(List.of("ready:t", "pre:t", "close:t"), journal.entries());
    }

    @Test
    void postConstructHooksCanBeDisabled() {
        registry.disablePostConstructHooks();
        registry.registerType(LOGGER, ConsoleLogger.class);

        ConsoleLogger logger = registry.resolve(LOGGER, ConsoleLogger.class);

        assertEquals(0, logger.getPostCreationCount());
        assertFalse(registry.getConfigurations().isPostConstructHooks());
        registry.enablePostConstructHooks();
        assertTrue(registry.getConfigurations().isPostConstructHooks());
    }

    @Test
    void typedResolutionRejectsIncompatibleInstances() {
        registry.registerInstance(LOGGER, "não sou um logger");

        ServiceConstructionException error = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(Logger.class));
        assertEquals(Reason.TYPE_MISMATCH, error.getReason());
    }

    @Test
    void singleArgumentConstructorReceivesTheRegistry() {
        registry.registerType(RegistryAware.class);

        assertSame(registry, registry.resolve(RegistryAware.class).getRegistry());
    }

    @Test
    @DisplayName("Plugin é localizado pela categoria e seletor e então injetado como um tipo")
    void pluginSourcesAreLocatedAndInjected() {
        registry.registerType(LOGGER, ConsoleLogger.class);
        registry.registerPlugin(ServiceKey.of("codec.gzip"), "codecs", "gzip");
        registry.registerPlugin(ServiceKey.of("codec.plain"), "codecs", "plain");

        GzipCodec gzip = registry.resolve(ServiceKey.of("codec.gzip"), GzipCodec.class);

        assertSame(registry.resolve(LOGGER), gzip.getLogger());
        assertInstanceOf(PlainCodec.class, registry.resolve(ServiceKey.of("codec.plain")));
    }

    @Test
    void unknownPluginFailsConstruction() {
        registry.registerPlugin(ServiceKey.of("codec.lz4"), "codecs", "lz4");

        ServiceConstructionException error = assertThrows(ServiceConstructionException.class,
                () -> registry.resolve(ServiceKey.of("codec.lz4")));
        assertEquals(Reason.CONSTRUCTION_FAILED, error.getReason());
        assertEquals(RegistrationState.FAILED, registry.stateOf(ServiceKey.of("codec.lz4")).orElseThrow());
    }
}
