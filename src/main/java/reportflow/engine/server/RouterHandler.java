package reportflow.engine.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import reportflow.engine.api.Controller;
import reportflow.engine.api.Controller.ControllerResponse;
import reportflow.engine.exception.BusyException;
import reportflow.engine.exception.NotFoundException;
import reportflow.engine.exception.NotReadyException;
import reportflow.engine.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_DISPOSITION;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers
 * and maps domain exceptions to status codes:
 *
 * - ValidationException, malformed JSON: 400
 * - NotFoundException: 404
 * - BusyException, NotReadyException: 409
 * - anything else: 500
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        boolean keepAlive = HttpUtil.isKeepAlive(req);
        writeSafe(ctx, route(ctx, req), keepAlive);
    }

    /**
     * Resolve a request to a response without touching the channel.
     */
    ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");

        } catch (ValidationException e) {
            log.info("Rejected {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            log.info("Malformed JSON for {} {}: {}", method, path, e.getOriginalMessage());
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (NotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (BusyException e) {
            log.info("{} {}: {}", method, path, e.getMessage());
            return ControllerResponse.conflict("already running");
        } catch (NotReadyException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.internalError("internal error: " + e.getMessage());
        }
    }

    private void writeSafe(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        try {
            byte[] bytes = response.body() == null ? new byte[0] : response.body();
            FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            http.headers().set(CONTENT_TYPE, response.contentType());
            http.headers().setInt(CONTENT_LENGTH, bytes.length);
            if (response.fileName() != null) {
                http.headers().set(CONTENT_DISPOSITION, "attachment; filename=\"" + response.fileName() + "\"");
            }

            if (keepAlive) {
                HttpUtil.setKeepAlive(http, true);
                ctx.writeAndFlush(http);
            } else {
                ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
            }
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
