package com.libragraph.artifacts.core.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;

@ApplicationScoped
public class ObjectCacheProducer {

    private static final Logger log = Logger.getLogger(ObjectCacheProducer.class);

    @ConfigProperty(name = "artifacts.cache.dir", defaultValue = "${user.home}/.cache/artifacts")
    String cacheDir;

    @Produces
    @Singleton
    public ObjectCache objectCache() {
        log.infof("Object cache at %s", cacheDir);
        return new ObjectCache(Path.of(cacheDir));
    }
}
