package dtm.registry.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marca uma classe concreta como candidata a plugin.
 *
 * A categoria do plugin é o pacote em que a classe se encontra; {@link #key()}
 * é o valor comparado com o seletor na busca.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Plugin {
    String key() default "";
}
