package dtm.registry.common;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.function.ToIntFunction;

public final class AnnotationsUtils {

    private AnnotationsUtils(){
        throw new IllegalStateException("utility class");
    }

    /**
     * Retorna todos os campos da classe (incluindo superclasses) que possuem a anotação especificada.
     * Campos das superclasses vêm primeiro, seguidos pelos da subclasse, na ordem de declaração.
     *
     * @param refClass         Classe de referência.
     * @param annotationClass  Classe da anotação.
     * @param <A>              Tipo da anotação.
     * @return Lista de campos anotados com a anotação fornecida.
     */
    public static <A extends Annotation> List<Field> getAllFieldWithAnnotation(Class<?> refClass, Class<A> annotationClass){
        Objects.requireNonNull(refClass, "refClass não pode ser null");
        Objects.requireNonNull(annotationClass, "annotationClass não pode ser null");

        Deque<List<Field>> hierarchy = new ArrayDeque<>();

        while (refClass != null && refClass != Object.class) {
            List<Field> declared = new ArrayList<>();
            for (Field field : refClass.getDeclaredFields()) {
                if (field.isAnnotationPresent(annotationClass)) {
                    declared.add(field);
                }
            }
            hierarchy.push(declared);
            refClass = refClass.getSuperclass();
        }

        List<Field> injectableFields = new ArrayList<>();
        hierarchy.forEach(injectableFields::addAll);
        return injectableFields;
    }

    /**
     * Retorna os métodos da hierarquia anotados com a anotação especificada, ordenados pela
     * função de ordem. Um método sobrescrito por uma subclasse aparece uma única vez.
     *
     * @param refClass         Classe de referência.
     * @param annotationClass  Classe da anotação.
     * @param order            Extrai a ordem a partir da anotação.
     * @param <A>              Tipo da anotação.
     * @return Lista ordenada de métodos.
     */
    public static <A extends Annotation> List<Method> getAllMethodWithAnnotation(Class<?> refClass, Class<A> annotationClass, ToIntFunction<A> order){
        Objects.requireNonNull(refClass, "refClass não pode ser null");
        Objects.requireNonNull(annotationClass, "annotationClass não pode ser null");

        List<Method> methods = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        while (refClass != null && refClass != Object.class) {
            for (Method method : refClass.getDeclaredMethods()) {
                if (method.isSynthetic() || method.isBridge()) continue;
                String signature = method.getName() + Arrays.toString(method.getParameterTypes());
                boolean overridable = !Modifier.isPrivate(method.getModifiers()) && !Modifier.isStatic(method.getModifiers());
                if (overridable && !seen.add(signature)) continue;
                if (method.isAnnotationPresent(annotationClass)) {
                    methods.add(method);
                }
            }
            refClass = refClass.getSuperclass();
        }

        methods.sort(Comparator.comparingInt(m -> order.applyAsInt(m.getAnnotation(annotationClass))));
        return methods;
    }

    public static boolean isConcreteClass(Class<?> clazz){
        return !clazz.isInterface()
                && !Modifier.isAbstract(clazz.getModifiers())
                && !clazz.isEnum()
                && !clazz.isAnnotation()
                && !clazz.isPrimitive()
                && !clazz.isArray();
    }
}
