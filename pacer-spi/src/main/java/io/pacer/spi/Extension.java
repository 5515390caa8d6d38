package io.pacer.spi;

import java.util.List;
import com.google.inject.Module;

/**
 * Set of Guice modules loaded through java.util.ServiceLoader. A jar that provides
 * an extension lists its class name in META-INF/services/io.pacer.spi.Extension.
 */
public interface Extension
{
    List<Module> getModules();
}
