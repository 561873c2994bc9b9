package dtm.registry.storage.metadata;

import dtm.registry.annotations.Inject;
import dtm.registry.annotations.PostCreation;
import dtm.registry.annotations.PreDestruction;
import dtm.registry.common.AnnotationsUtils;
import dtm.registry.core.ServiceRegistryGetter;
import dtm.registry.core.TypeMetadata;
import dtm.registry.exceptions.TypeMetadataException;
import dtm.registry.prototypes.InjectionSlot;
import dtm.registry.prototypes.ServiceKey;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.lang.annotation.Annotation;
import java.lang.invoke.MethodType;
import java.lang.reflect.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToIntFunction;

/**
 * {@link TypeMetadata} baseado em reflexão e nas anotações do registro.
 * <ul>
 *     <li>Construtor padrão: o construtor sem argumentos ou, na ausência dele, um construtor
 *     de um único argumento que aceite o registro dono;</li>
 *     <li>Pontos de injeção: campos anotados com {@link Inject} em toda a hierarquia;</li>
 *     <li>Ganchos: métodos sem parâmetros anotados com {@link PostCreation} e {@link PreDestruction}.</li>
 * </ul>
 */
@Slf4j
public class ReflectiveTypeMetadata implements TypeMetadata {
    private final ServiceRegistryGetter owner;
    private final Map<Class<?>, List<InjectionSlot>> slotCache;

    public ReflectiveTypeMetadata(){
        this(null);
    }

    public ReflectiveTypeMetadata(ServiceRegistryGetter owner){
        this.owner = owner;
        this.slotCache = new ConcurrentHashMap<>();
    }

    @Override
    public <T> T constructStandard(@NonNull Class<T> type) throws TypeMetadataException {
        if(!AnnotationsUtils.isConcreteClass(type)){
            throw new TypeMetadataException("Registre uma classe concreta para: " + type.getName(), type);
        }
        if(type.isMemberClass() && !Modifier.isStatic(type.getModifiers())){
            throw new TypeMetadataException("Classe interna não estática não pode ser construída: " + type.getName(), type);
        }

        final Constructor<T> constructor = selectConstructor(type);
        try{
            constructor.setAccessible(true);
            T instance = (constructor.getParameterCount() == 0)
                    ? constructor.newInstance()
                    : constructor.newInstance(owner);
            log.trace("Instância de {} criada pelo construtor padrão", type.getName());
            return instance;
        }catch (InvocationTargetException e){
            Throwable cause = e.getTargetException();
            throw new TypeMetadataException("Erro no construtor de " + type.getName() + " ==> causa: " + cause.getMessage(), type, cause);
        }catch (ReflectiveOperationException | RuntimeException e){
            throw new TypeMetadataException("Erro ao criar Objeto " + type.getName() + " ==> causa: " + e.getMessage(), type, e);
        }
    }

    @Override
    public List<InjectionSlot> injectableSlots(@NonNull Class<?> type) throws TypeMetadataException {
        List<InjectionSlot> cached = slotCache.get(type);
        if(cached != null) return cached;

        List<InjectionSlot> slots = new ArrayList<>();
        for (Field field : AnnotationsUtils.getAllFieldWithAnnotation(type, Inject.class)){
            slots.add(toSlot(type, field));
        }

        List<InjectionSlot> immutable = List.copyOf(slots);
        slotCache.putIfAbsent(type, immutable);
        return immutable;
    }

    @Override
    public void invokePostConstructHook(@NonNull Object instance) throws TypeMetadataException {
        invokeHooks(instance, PostCreation.class, PostCreation::order);
    }

    @Override
    public void invokePreDestroyHook(@NonNull Object instance) throws TypeMetadataException {
        invokeHooks(instance, PreDestruction.class, PreDestruction::order);
    }

    private <T> Constructor<T> selectConstructor(Class<T> type){
        Constructor<?> fallback = null;
        for (Constructor<?> constructor : type.getDeclaredConstructors()){
            if(constructor.getParameterCount() == 0){
                return cast(constructor);
            }
            if(constructor.getParameterCount() == 1 && owner != null
                    && acceptsOwner(constructor.getParameterTypes()[0])){
                fallback = constructor;
            }
        }
        if(fallback != null){
            return cast(fallback);
        }
        throw new TypeMetadataException(
                "Nenhum construtor padrão encontrado para " + type.getName()
                        + " (esperado construtor vazio ou de um argumento recebendo o registro)",
                type
        );
    }

    private boolean acceptsOwner(Class<?> parameterType){
        return ServiceRegistryGetter.class.isAssignableFrom(parameterType) && parameterType.isInstance(owner);
    }

    @SuppressWarnings("unchecked")
    private static <T> Constructor<T> cast(Constructor<?> constructor){
        return (Constructor<T>) constructor;
    }

    private InjectionSlot toSlot(Class<?> type, Field field){
        final int modifiers = field.getModifiers();
        if(Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers)){
            throw new TypeMetadataException(
                    "Campo @Inject '" + field.getName() + "' em " + type.getName() + " não pode ser static nem final",
                    type
            );
        }

        final Inject inject = field.getAnnotation(Inject.class);
        final ServiceKey key = (inject.key() == null || inject.key().isBlank())
                ? ServiceKey.of(field.getType())
                : ServiceKey.of(inject.key());

        return new InjectionSlot(key, field.getName(), (target, value) -> {
            if(value != null && !wrap(field.getType()).isInstance(value)){
                throw new TypeMetadataException(
                        "Serviço " + key + " do tipo " + value.getClass().getName()
                                + " não é compatível com o campo '" + field.getName() + "' (" + field.getType().getName() + ")",
                        type
                );
            }
            if(!field.canAccess(target)){
                field.setAccessible(true);
            }
            field.set(target, value);
        });
    }

    private <A extends Annotation> void invokeHooks(Object instance, Class<A> annotation, ToIntFunction<A> order){
        final Class<?> clazz = instance.getClass();
        for (Method method : AnnotationsUtils.getAllMethodWithAnnotation(clazz, annotation, order)){
            if(method.getParameterCount() != 0){
                throw new TypeMetadataException(
                        "Método @" + annotation.getSimpleName() + " '" + method.getName() + "' em " + clazz.getName() + " não pode receber parâmetros",
                        clazz
                );
            }
            try{
                method.setAccessible(true);
                method.invoke(instance);
            }catch (InvocationTargetException e){
                Throwable cause = e.getTargetException();
                throw new TypeMetadataException(
                        "Erro ao executar metodo: " + method.getName() + " de @" + annotation.getSimpleName() + " em " + clazz.getName() + " ==> causa: " + cause.getMessage(),
                        clazz,
                        cause
                );
            }catch (ReflectiveOperationException | RuntimeException e){
                throw new TypeMetadataException(
                        "Não foi possível executar " + method.getName() + " em " + clazz.getName() + " ==> causa: " + e.getMessage(),
                        clazz,
                        e
                );
            }
        }
    }

    private static Class<?> wrap(Class<?> type){
        if(!type.isPrimitive()) return type;
        return MethodType.methodType(type).wrap().returnType();
    }
}
