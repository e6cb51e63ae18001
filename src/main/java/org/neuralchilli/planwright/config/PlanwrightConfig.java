package org.neuralchilli.planwright.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import org.neuralchilli.planwright.domain.GatingRule;
import org.neuralchilli.planwright.domain.ReconcileMode;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "planwright")
public interface PlanwrightConfig {

    Store store();

    Scheduler scheduler();

    Reconciler reconciler();

    Coordinator coordinator();

    Worker worker();

    interface Store {

        /**
         * Name of the status record, also the Hazelcast map key.
         */
        @WithDefault("planwright-status")
        String name();

        /**
         * JSON file mirroring every commit; loaded at startup when present.
         */
        Optional<String> file();

        Lock lock();

        interface Lock {

            @WithName("poll-interval")
            @WithDefault("50ms")
            Duration pollInterval();

            @WithDefault("10s")
            Duration timeout();

            /**
             * Must exceed the longest expected single update.
             */
            @WithDefault("2m")
            Duration staleness();
        }
    }

    interface Scheduler {

        /**
         * Applied to phases that do not declare a gating rule.
         */
        @WithName("default-gating-rule")
        @WithDefault("ALL_COMPLETED")
        GatingRule defaultGatingRule();
    }

    interface Reconciler {

        /**
         * Directory deliverable references are resolved against.
         */
        @WithDefault(".")
        String root();

        @WithName("min-length")
        @WithDefault("200")
        int minLength();

        @WithName("unresolved-markers")
        @WithDefault("TODO,TBD,FIXME,PLACEHOLDER")
        List<String> unresolvedMarkers();

        Watch watch();

        interface Watch {

            @WithDefault("false")
            boolean enabled();

            @WithDefault("60s")
            Duration interval();

            @WithDefault("REPORT")
            ReconcileMode mode();
        }
    }

    interface Coordinator {

        @WithName("concurrency-limit")
        @WithDefault("4")
        int concurrencyLimit();

        @WithName("worker-id")
        @WithDefault("worker-local")
        String workerId();
    }

    interface Worker {

        /**
         * Command and arguments run once per item.
         */
        Optional<List<String>> command();

        @WithName("trial-run")
        @WithDefault("false")
        boolean trialRun();

        @WithDefault("1h")
        Duration timeout();

        @WithName("incomplete-exit-code")
        @WithDefault("75")
        int incompleteExitCode();
    }
}
