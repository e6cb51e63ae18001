package org.neuralchilli.planwright.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.planwright.domain.LockToken;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.serializer.LockTokenSerializer;
import org.neuralchilli.planwright.serializer.StatusRecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures and produces the embedded Hazelcast instance holding the status
 * record and its lock, with custom serializers for both.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "hazelcast.cluster-name", defaultValue = "planwright-dev")
    String clusterName;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        Config config = new Config();
        config.setClusterName(clusterName);

        // Embedded instance, no network join
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);

        registerSerializers(config.getSerializationConfig());

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(config);
        log.info("Hazelcast instance created successfully");
        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        log.info("Shutting down Hazelcast instance");
        instance.shutdown();
    }

    /**
     * Custom serializers for everything stored in Hazelcast maps.
     */
    public static void registerSerializers(SerializationConfig serializationConfig) {
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(StatusRecord.class)
                .setImplementation(new StatusRecordSerializer()));
        log.debug("Registered StatusRecordSerializer (TYPE_ID: 2001)");

        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(LockToken.class)
                .setImplementation(new LockTokenSerializer()));
        log.debug("Registered LockTokenSerializer (TYPE_ID: 2002)");
    }
}
