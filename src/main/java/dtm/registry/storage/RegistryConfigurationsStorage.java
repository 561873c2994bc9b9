package dtm.registry.storage;

import dtm.registry.core.RegistryConfigurations;
import dtm.registry.core.TeardownOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;

@ToString
@Builder(toBuilder = true)
public class RegistryConfigurationsStorage implements RegistryConfigurations {

    private static final RegistryConfigurations DEFAULTS = new RegistryConfigurations() {};

    @NonNull
    @Builder.Default
    private final TeardownOrder teardownOrder = DEFAULTS.getTeardownOrder();

    @Builder.Default
    private final boolean postConstructHooks = DEFAULTS.isPostConstructHooks();

    @NonNull
    @Builder.Default
    private final String pluginRootPackage = DEFAULTS.getPluginRootPackage();

    @Builder.Default
    private final boolean selfRegistration = DEFAULTS.isSelfRegistration();

    public static RegistryConfigurationsStorage defaults(){
        return builder().build();
    }

    public static RegistryConfigurationsStorage copyOf(@NonNull RegistryConfigurations configurations){
        if(configurations instanceof RegistryConfigurationsStorage storage){
            return storage;
        }
        return builder()
                .teardownOrder(configurations.getTeardownOrder())
                .postConstructHooks(configurations.isPostConstructHooks())
                .pluginRootPackage(configurations.getPluginRootPackage())
                .selfRegistration(configurations.isSelfRegistration())
                .build();
    }

    @Override
    public TeardownOrder getTeardownOrder() {
        return teardownOrder;
    }

    @Override
    public boolean isPostConstructHooks() {
        return postConstructHooks;
    }

    @Override
    public String getPluginRootPackage() {
        return pluginRootPackage;
    }

    @Override
    public boolean isSelfRegistration() {
        return selfRegistration;
    }
}
