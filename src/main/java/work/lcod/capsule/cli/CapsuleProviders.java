package work.lcod.capsule.cli;

import java.util.ArrayList;
import java.util.ServiceLoader;
import work.lcod.capsule.api.CapsuleProvider;

/**
 * Finds the provider of a named capsule: an explicit provider class when given, otherwise the service-loaded
 * provider whose name matches.
 */
final class CapsuleProviders {
    private CapsuleProviders() {}

    static CapsuleProvider resolve(String name, String providerClass) {
        if (providerClass != null && !providerClass.isBlank()) {
            return instantiate(providerClass);
        }
        var available = new ArrayList<String>();
        for (var provider : ServiceLoader.load(CapsuleProvider.class)) {
            if (provider.name().equals(name)) {
                return provider;
            }
            available.add(provider.name());
        }
        throw new IllegalArgumentException("Unknown capsule '" + name + "' (available: " + String.join(", ", available) + ")");
    }

    private static CapsuleProvider instantiate(String className) {
        Object instance;
        try {
            instance = Class.forName(className).getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException ex) {
            throw new IllegalArgumentException("Cannot load capsule provider " + className + ": " + ex.getMessage(), ex);
        }
        if (instance instanceof CapsuleProvider provider) {
            return provider;
        }
        throw new IllegalArgumentException(className + " does not implement " + CapsuleProvider.class.getName());
    }
}
