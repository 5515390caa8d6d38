package io.pacer.core;

import java.util.ServiceLoader;
import com.google.inject.Binder;
import com.google.inject.Module;
import io.pacer.spi.Extension;

/**
 * Installs the modules of every {@link Extension} registered in
 * META-INF/services/io.pacer.spi.Extension of the class path, so that a jar
 * can contribute DueTimeCalculatorFactory or JobQueue bindings without code changes.
 */
public class ExtensionServiceLoaderModule
        implements Module
{
    private final ClassLoader classLoader;

    public ExtensionServiceLoaderModule()
    {
        this(ExtensionServiceLoaderModule.class.getClassLoader());
    }

    public ExtensionServiceLoaderModule(ClassLoader classLoader)
    {
        this.classLoader = classLoader;
    }

    @Override
    public void configure(Binder binder)
    {
        ServiceLoader.load(Extension.class, classLoader).stream()
            .map(ServiceLoader.Provider::get)
            .flatMap(extension -> extension.getModules().stream())
            .forEach(binder::install);
    }
}
