package dtm.registry.storage.plugin;

import dtm.registry.exceptions.PluginNotFoundException;
import dtm.registry.fixtures.codecs.GzipCodec;
import dtm.registry.fixtures.codecs.PlainCodec;
import dtm.registry.fixtures.codecs.experimental.ZstdCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClassPathPluginLocatorTest {

    private final ClassPathPluginLocator locator = new ClassPathPluginLocator("dtm.registry.fixtures");

    @Test
    void selectorPicksTheMatchingPlugin() {
        assertEquals(GzipCodec.class, locator.resolvePlugin("codecs", "gzip"));
        assertEquals(PlainCodec.class, locator.resolvePlugin("codecs", "plain"));
    }

    @Test
    @DisplayName("Sem seletor vence o primeiro plugin concreto pelo nome da classe")
    void missingSelectorPicksFirstByName() {
        assertEquals(GzipCodec.class, locator.resolvePlugin("codecs", null));
    }

    @Test
    @DisplayName("Subpacotes não são visitados")
    void searchIsNotRecursive() {
        PluginNotFoundException error = assertThrows(PluginNotFoundException.class,
                () -> locator.resolvePlugin("codecs", "zstd"));

        assertEquals("codecs", error.getCategory());
        assertEquals("zstd", error.getSelector());
        assertEquals(ZstdCodec.class, locator.resolvePlugin("codecs/experimental", "zstd"));
    }

    @Test
    void abstractAndInterfaceCandidatesAreSkipped() {
        assertThrows(PluginNotFoundException.class, () -> locator.resolvePlugin("codecs", "abstract"));
        assertThrows(PluginNotFoundException.class, () -> locator.resolvePlugin("codecs", "interface"));
    }

    @Test
    void absoluteCategoriesIgnoreTheRootPackage() {
        ClassPathPluginLocator elsewhere = new ClassPathPluginLocator("some.other.root");

        assertEquals(ZstdCodec.class, elsewhere.resolvePlugin("/dtm/registry/fixtures/codecs/experimental", null));
        assertThrows(PluginNotFoundException.class, () -> elsewhere.resolvePlugin("codecs", null));
    }

    @Test
    void categoryNamesAreNormalized() {
        assertEquals("dtm.registry.fixtures.codecs", locator.toPackageName("codecs/"));
        assertEquals("dtm.registry.fixtures.codecs.experimental", locator.toPackageName("codecs.experimental"));
        assertEquals("a.b", locator.toPackageName("/a/b"));
    }

    @Test
    void emptyCategoryIsTheRootItself() {
        assertThrows(PluginNotFoundException.class, () -> locator.resolvePlugin("", null));
    }
}
