package dtm.registry.storage.plugin;

import dtm.registry.annotations.Plugin;
import dtm.registry.common.AnnotationsUtils;
import dtm.registry.core.PluginLocator;
import dtm.registry.exceptions.PluginNotFoundException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import org.reflections.Reflections;
import org.reflections.ReflectionsException;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Localiza plugins no classpath.
 * <p>
 * A categoria é um pacote, escrito com {@code .} ou {@code /}. Categorias relativas são
 * resolvidas sob o pacote raiz; categorias iniciadas por {@code /} são absolutas.
 * Apenas as classes diretamente no pacote são candidatas (subpacotes não são visitados),
 * e somente classes concretas anotadas com {@link Plugin}.
 * <p>
 * Com seletor, vence o candidato cuja {@link Plugin#key()} for igual ao seletor.
 * Sem seletor, vence o primeiro candidato pela ordem do nome da classe.
 */
@Slf4j
public class ClassPathPluginLocator implements PluginLocator {
    private final String rootPackage;
    private final ClassLoader classLoader;

    public ClassPathPluginLocator(@NonNull String rootPackage){
        this(rootPackage, defaultClassLoader());
    }

    public ClassPathPluginLocator(@NonNull String rootPackage, @NonNull ClassLoader classLoader){
        this.rootPackage = normalize(rootPackage);
        this.classLoader = classLoader;
    }

    @Override
    public Class<?> resolvePlugin(@NonNull String category, String selector) throws PluginNotFoundException {
        final String packageName = toPackageName(category);
        final List<Class<?>> candidates;
        try{
            candidates = findCandidates(packageName);
        }catch (ReflectionsException e){
            throw new PluginNotFoundException(
                    "Erro ao listar plugins da categoria '" + category + "' ==> causa: " + e.getMessage(),
                    category,
                    selector,
                    e
            );
        }

        log.debug("Categoria '{}' ({}) possui {} candidato(s) a plugin", category, packageName, candidates.size());

        return candidates.stream()
                .filter(candidate -> selector == null || selector.equals(candidate.getAnnotation(Plugin.class).key()))
                .findFirst()
                .orElseThrow(() -> new PluginNotFoundException(
                        "Nenhum plugin encontrado para a categoria '" + category + "'"
                                + (selector == null ? "" : " com a chave '" + selector + "'"),
                        category,
                        selector
                ));
    }

    String toPackageName(String category){
        String trimmed = category.strip();
        if(trimmed.startsWith("/")){
            return normalize(trimmed);
        }
        String relative = normalize(trimmed);
        if(rootPackage.isEmpty()) return relative;
        if(relative.isEmpty()) return rootPackage;
        return rootPackage + "." + relative;
    }

    private List<Class<?>> findCandidates(String packageName){
        final ConfigurationBuilder configuration = new ConfigurationBuilder()
                .forPackage(packageName, classLoader)
                .addClassLoaders(classLoader)
                .setScanners(Scanners.TypesAnnotated, Scanners.SubTypes);
        if(!packageName.isEmpty()){
            configuration.filterInputsBy(new FilterBuilder().includePackage(packageName));
        }

        Reflections reflections = new Reflections(configuration);

        // subpacotes também são varridos; apenas o próprio pacote conta
        return reflections.getTypesAnnotatedWith(Plugin.class).stream()
                .filter(clazz -> clazz.getPackageName().equals(packageName))
                .filter(clazz -> clazz.isAnnotationPresent(Plugin.class))
                .filter(AnnotationsUtils::isConcreteClass)
                .sorted(Comparator.comparing(Class::getName))
                .collect(Collectors.toList());
    }

    private static String normalize(String name){
        String normalized = name.strip().replace('/', '.');
        while (normalized.startsWith(".")) normalized = normalized.substring(1);
        while (normalized.endsWith(".")) normalized = normalized.substring(0, normalized.length() - 1);
        return normalized;
    }

    private static ClassLoader defaultClassLoader(){
        ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : ClassPathPluginLocator.class.getClassLoader();
    }
}
