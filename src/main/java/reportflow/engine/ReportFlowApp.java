package reportflow.engine;

import reportflow.engine.config.Dependencies;
import reportflow.engine.config.EngineConfig;
import reportflow.engine.server.ReportFlowServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: wire everything from the environment, start the scheduler and
 * the HTTP server, and block until the JVM is asked to exit.
 */
public final class ReportFlowApp {

    private static final Logger log = LoggerFactory.getLogger(ReportFlowApp.class);

    private ReportFlowApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        EngineConfig config = EngineConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        ReportingEngine engine = new ReportingEngine(deps);
        ReportFlowServer server = new ReportFlowServer(config.serverHost(), config.serverPort(), deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            engine.shutdown();
            deps.close();
            stopped.countDown();
        }, "reportflow-shutdown"));

        engine.startup();
        server.start();
        stopped.await();
    }
}
