package dtm.registry.prototypes;

import dtm.registry.fixtures.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ServiceKeyTest {

    @Test
    @DisplayName("Chave por classe e por nome endereçam o mesmo serviço")
    void classAndNameKeysAreEqual() {
        ServiceKey byClass = ServiceKey.of(Logger.class);
        ServiceKey byName = ServiceKey.of("dtm.registry.fixtures.Logger");

        assertEquals(byClass, byName);
        assertEquals(byClass.hashCode(), byName.hashCode());
        assertEquals("x", Map.of(byClass, "x").get(byName));
    }

    @Test
    @DisplayName("Nome vazio é rejeitado e espaços nas bordas são ignorados")
    void blankNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ServiceKey.of("  "));
        assertThrows(NullPointerException.class, () -> ServiceKey.of((String) null));
        assertEquals(ServiceKey.of("mail"), ServiceKey.of(" mail "));
    }

    @Test
    void keysAreOrderedByName() {
        TreeSet<ServiceKey> keys = new TreeSet<>();
        keys.add(ServiceKey.of("b"));
        keys.add(ServiceKey.of("a"));
        keys.add(ServiceKey.of("c"));

        assertEquals("a", keys.first().getName());
        assertEquals("c", keys.last().toString());
    }

    @Test
    void scopesCompareByName() {
        assertEquals(Scope.APPLICATION, Scope.of("application"));
        assertNotEquals(Scope.APPLICATION, Scope.TRANSIENT);
        assertThrows(IllegalArgumentException.class, () -> Scope.of(""));
    }

    @Test
    @DisplayName("Somente tipos e plugins recebem injeção de propriedades")
    void propertyInjectionDependsOnSourceKind() {
        assertTrue(ServiceSource.ofType(String.class).isPropertyInjected());
        assertTrue(ServiceSource.ofPlugin("codecs", null).isPropertyInjected());
        assertFalse(ServiceSource.ofInstance("x").isPropertyInjected());
        assertFalse(ServiceSource.ofFunction(args -> "x").isPropertyInjected());
    }

    @Test
    void emptyPluginSelectorMeansAnyCandidate() {
        ServiceSource.PluginSource source = (ServiceSource.PluginSource) ServiceSource.ofPlugin("codecs", "");
        assertNull(source.getSelector());
        assertEquals("codecs", source.getCategory());
    }
}
