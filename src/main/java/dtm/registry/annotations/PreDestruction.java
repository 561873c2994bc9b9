package dtm.registry.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marca um método sem parâmetros a ser executado quando o registro destrói a instância,
 * antes de {@link AutoCloseable#close()}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface PreDestruction {
    int order() default 0;
}
