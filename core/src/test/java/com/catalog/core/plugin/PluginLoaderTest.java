package com.catalog.core.plugin;

import com.catalog.common.util.Checksums;
import com.catalog.test.TestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PluginLoaderTest extends TestBase {

    @TempDir
    Path pluginDir;

    private void writePlugin(String name, byte[] jar, String checksum) throws Exception {
        Files.write(pluginDir.resolve(name + ".jar"), jar);
        Files.writeString(pluginDir.resolve(name + ".json"),
                "{\"id\": \"echo\", \"version\": \"0.1\", \"formats\": [\"*\"], \"priority\": 2, \"checksum\": \"" + checksum + "\"}",
                StandardCharsets.UTF_8);
    }

    @Test
    void testLoadsDescriptorJarPairs() throws Exception {
        byte[] jar = JarResolverFactoryTest.serviceJar(EchoResolverPlugin.class.getName());
        writePlugin("echo", jar, "sha256:" + Checksums.sha256(jar));
        ResolverRegistry registry = new ResolverRegistry(new JarResolverFactory());
        PluginLoader loader = new PluginLoader(registry, config);

        List<PluginDescriptor> loaded = loader.loadPlugins(pluginDir.toFile());

        assertEquals(1, loaded.size());
        assertEquals(2, loaded.get(0).getPriority());
        assertTrue(registry.isLoaded("echo"));
        assertTrue(loader.isConfigChanged());
        assertEquals("true", config.getPluginSetting("echo", "enabled", null));
        registry.close();
    }

    @Test
    void testBadChecksumIsSkipped() throws Exception {
        byte[] jar = JarResolverFactoryTest.serviceJar(EchoResolverPlugin.class.getName());
        writePlugin("echo", jar, "sha256:" + Checksums.sha256("something else".getBytes()));
        ResolverRegistry registry = new ResolverRegistry(new JarResolverFactory());

        List<PluginDescriptor> loaded = new PluginLoader(registry, config).loadPlugins(pluginDir.toFile());

        assertTrue(loaded.isEmpty());
        assertEquals(LoadState.REJECTED, registry.state("echo").orElseThrow());
    }

    @Test
    void testDisabledPluginIsNotLoaded() throws Exception {
        byte[] jar = JarResolverFactoryTest.serviceJar(EchoResolverPlugin.class.getName());
        writePlugin("echo", jar, "sha256:" + Checksums.sha256(jar));
        config.setPluginSetting("echo", "enabled", "false");
        ResolverRegistry registry = new ResolverRegistry(new JarResolverFactory());

        assertTrue(new PluginLoader(registry, config).loadPlugins(pluginDir.toFile()).isEmpty());
        assertFalse(registry.isLoaded("echo"));
    }

    @Test
    void testDescriptorWithoutJarIsSkipped() throws Exception {
        Files.writeString(pluginDir.resolve("lonely.json"), "{\"id\": \"lonely\", \"checksum\": \"00\"}");
        ResolverRegistry registry = new ResolverRegistry(new JarResolverFactory());

        assertTrue(new PluginLoader(registry, config).loadPlugins(pluginDir.toFile()).isEmpty());
    }
}
