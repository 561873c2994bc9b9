package dtm.registry.exceptions;

import lombok.Getter;

@Getter
public class PluginNotFoundException extends ServiceRegistryException{
    private final String category;
    private final String selector;

    public PluginNotFoundException(String message, String category, String selector){
        super(message);
        this.category = category;
        this.selector = selector;
    }

    public PluginNotFoundException(String message, String category, String selector, Throwable th){
        super(message, th);
        this.category = category;
        this.selector = selector;
    }
}
