package reportflow.engine.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;

/**
 * One group of REST endpoints, selected by method and path.
 *
 * Domain exceptions thrown from {@link #handle} are mapped to status codes by
 * the router, so controllers only deal with the success path.
 */
public interface Controller {

    /** @param path request path without the query string */
    boolean matches(HttpMethod method, String path);

    /**
     * Runs on the router's request executor, never on the I/O loop, so it may block.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Response from a controller. {@code fileName} is set for downloads.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            byte[] body,
            String fileName) {

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json; charset=utf-8",
                    body.getBytes(StandardCharsets.UTF_8), null);
        }

        public static ControllerResponse file(String contentType, byte[] content, String fileName) {
            return new ControllerResponse(HttpResponseStatus.OK, contentType, content, fileName);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return json(status, "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse conflict(String message) {
            return error(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse internalError(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        private static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
