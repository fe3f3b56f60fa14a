package reportflow.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import reportflow.engine.api.Controller;
import reportflow.engine.api.v1.dto.HealthResponse;
import reportflow.engine.runner.ExclusivityTokens;
import reportflow.engine.scheduler.Scheduler;
import reportflow.engine.server.RouterHandler;
import reportflow.engine.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final Scheduler scheduler;
    private final ExclusivityTokens tokens;

    public HealthController(Database database, Scheduler scheduler, ExclusivityTokens tokens) {
        this.database = database;
        this.scheduler = scheduler;
        this.tokens = tokens;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            log.warn("Health check: database unreachable");
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
        }

        HealthResponse response = HealthResponse.healthy(
                formatUptime(),
                VERSION,
                scheduler.isRunning(),
                scheduler.calendar().size(),
                tokens.runningCount());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
