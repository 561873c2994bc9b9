package dtm.registry.exceptions;

public class ServiceRegistryException extends RuntimeException{

    public ServiceRegistryException(String message){
        super(message);
    }

    public ServiceRegistryException(Throwable cause) {
        super(cause);
    }

    public ServiceRegistryException(String message, Throwable th){
        super(message, th);
    }

}
