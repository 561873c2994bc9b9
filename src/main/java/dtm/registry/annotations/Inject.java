package dtm.registry.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Indica que um campo deve receber um serviço resolvido pelo registro.
 *
 * Por padrão a chave do serviço é o nome qualificado do tipo do campo.
 * Use {@link #key()} quando o serviço estiver registrado sob outra chave.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Inject {
    /**
     * Chave explícita do serviço. Vazio usa o tipo do campo.
     *
     * @return o nome da chave
     */
    String key() default "";
}
