package com.catalog.core.plugin;

import com.catalog.api.ResolveRequest;
import com.catalog.api.ResolverPlugin;
import com.catalog.common.model.ResolvedStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Instantiates a plugin from jar bytes. The verified bytes are written to a temp file so the
 * class loader reads exactly what was checksummed, then {@link ServiceLoader} picks the
 * {@link ResolverPlugin} whose id matches the descriptor.
 */
public class JarResolverFactory implements ResolverFactory {
    private static final Logger logger = LoggerFactory.getLogger(JarResolverFactory.class);

    private final ClassLoader parent;
    private final Path tempDir;

    public JarResolverFactory() {
        this(JarResolverFactory.class.getClassLoader(), null);
    }

    /** @param tempDir where verified jars are written; {@code null} for the system temp folder */
    public JarResolverFactory(ClassLoader parent, Path tempDir) {
        this.parent = parent;
        this.tempDir = tempDir;
    }

    @Override
    public ResolverPlugin create(PluginDescriptor descriptor, byte[] bytes) throws IOException {
        String prefix = "resolver-" + descriptor.getId() + "-";
        Path jar = tempDir == null
                ? Files.createTempFile(prefix, ".jar")
                : Files.createTempFile(tempDir, prefix, ".jar");

        URLClassLoader ucl;
        try {
            Files.write(jar, bytes);
            ucl = new URLClassLoader(new URL[] { jar.toUri().toURL() }, parent);
        } catch (IOException | RuntimeException e) {
            deleteJar(jar);
            throw e;
        }
        try {
            ServiceLoader<ResolverPlugin> loader = ServiceLoader.load(ResolverPlugin.class, ucl);
            for (ResolverPlugin plugin : loader) {
                if (descriptor.getId().equals(plugin.getId())) {
                    logger.debug("Found {} in {}", plugin.getClass().getName(), jar.getFileName());
                    return new ClassLoaderBoundPlugin(plugin, ucl, jar);
                }
                logger.debug("Skipping {} (id {} != {})", plugin.getClass().getName(), plugin.getId(), descriptor.getId());
            }
        } catch (RuntimeException | ServiceConfigurationError e) {
            cleanup(ucl, jar);
            throw new PluginLoadException("ServiceLoader failed for plugin " + descriptor.getId(), e);
        }
        cleanup(ucl, jar);
        throw new PluginLoadException("No ResolverPlugin with id '" + descriptor.getId() + "' in jar", null);
    }

    private static void cleanup(URLClassLoader ucl, Path jar) {
        try {
            ucl.close();
        } catch (IOException e) {
            logger.warn("Failed to close ClassLoader for {}", jar, e);
        }
        deleteJar(jar);
    }

    private static void deleteJar(Path jar) {
        try {
            Files.deleteIfExists(jar);
        } catch (IOException e) {
            logger.warn("Failed to delete temp jar {}", jar, e);
        }
    }

    /** Delegates to the plugin and releases its class loader and temp jar on close. */
    private static final class ClassLoaderBoundPlugin implements ResolverPlugin {
        private final ResolverPlugin delegate;
        private final URLClassLoader classLoader;
        private final Path jar;

        ClassLoaderBoundPlugin(ResolverPlugin delegate, URLClassLoader classLoader, Path jar) {
            this.delegate = delegate;
            this.classLoader = classLoader;
            this.jar = jar;
        }

        @Override
        public String getId() {
            return delegate.getId();
        }

        @Override
        public String getVersion() {
            return delegate.getVersion();
        }

        @Override
        public Optional<ResolvedStream> resolve(ResolveRequest request) throws Exception {
            return delegate.resolve(request);
        }

        @Override
        public void close() {
            try {
                delegate.close();
            } finally {
                cleanup(classLoader, jar);
            }
        }
    }
}
