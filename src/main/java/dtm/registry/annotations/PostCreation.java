package dtm.registry.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;


/**
 * Indica que um método deve ser executado logo após a criação e injeção
 * de serviços de um objeto pelo registro.
 *
 * O método não pode receber parâmetros. Quando existem vários métodos anotados
 * na hierarquia, a ordem de execução segue {@link #order()}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface PostCreation {
    int order() default 0;
}
