package org.neuralchilli.planwright.config;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;

/**
 * Isolated, in-memory Hazelcast member for plain unit tests.
 * Registers the same serializers as the application.
 */
public final class EmbeddedHazelcast {

    private EmbeddedHazelcast() {
    }

    public static HazelcastInstance start(String clusterPrefix) {
        Config config = new Config();
        config.setClusterName(clusterPrefix + "-" + System.currentTimeMillis());

        // Disable all network features for isolated testing
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        // Ensure writes are immediately visible
        config.getMapConfig("*").setBackupCount(0).setAsyncBackupCount(0);
        config.getMetricsConfig().setEnabled(false);

        HazelcastConfig.registerSerializers(config.getSerializationConfig());

        return Hazelcast.newHazelcastInstance(config);
    }
}
