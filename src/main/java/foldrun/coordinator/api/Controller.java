package foldrun.coordinator.api;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller. Text bodies are UTF-8.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            byte[] body,
            Map<String, String> headers) {

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json; charset=utf-8", utf8(body), Map.of());
        }

        /**
         * Raw bytes offered to the client as a file download.
         */
        public static ControllerResponse attachment(byte[] body, String fileName) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/octet-stream", body,
                    Map.of("Content-Disposition", "attachment; filename=\"" + fileName + "\""));
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse unavailable(String message) {
            return error(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        public static ControllerResponse error(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return json(status, "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        /**
         * Escape a value for use inside a JSON string literal, control characters included.
         */
        public static String escapeJson(String s) {
            if (s == null)
                return "";
            return new String(JsonStringEncoder.getInstance().quoteAsString(s));
        }

        private static byte[] utf8(String s) {
            return (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
        }
    }
}
