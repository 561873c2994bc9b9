package dtm.registry.exceptions;

import lombok.Getter;

@Getter
public class TypeMetadataException extends ServiceRegistryException{
    private final Class<?> referenceClass;

    public TypeMetadataException(String message, Class<?> referenceClass, Throwable th){
        super(message, th);
        this.referenceClass = referenceClass;
    }
    public TypeMetadataException(String message, Class<?> referenceClass){
        super(message);
        this.referenceClass = referenceClass;
    }
}
