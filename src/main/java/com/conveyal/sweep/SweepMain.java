package com.conveyal.sweep;

import com.conveyal.sweep.components.Components;
import com.conveyal.sweep.components.LocalComponents;
import com.conveyal.sweep.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the main entry point for starting a transit sweep server.
 */
public abstract class SweepMain {

    private static final Logger LOG = LoggerFactory.getLogger(SweepMain.class);

    public static void main (String... args) {
        // The Spark server threads are not daemons and will keep the JVM alive if the main thread crashes.
        // If initialization fails, we need to catch the exception or error and force JVM shutdown.
        try {
            Components components = new LocalComponents();
            components.httpApi.awaitInitialization();
            Runtime.getRuntime().addShutdownHook(new Thread(components::shutDown, "shutdown"));
            LOG.info("Transit sweep server is ready on port {}.", components.config.serverPort());
        } catch (Throwable throwable) {
            LOG.error("Exception while starting up sweep server, shutting down JVM.\n{}",
                    ExceptionUtils.stackTraceString(throwable));
            System.exit(1);
        }
    }

}
