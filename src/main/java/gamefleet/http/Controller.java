package gamefleet.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

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
     * Handle the request. Domain and auth exceptions propagate to the router,
     * which maps them to status codes.
     */
    ControllerResponse handle(RequestContext request) throws Exception;

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(Object value) {
            return json(HttpResponseStatus.OK, value);
        }

        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            try {
                String body = value instanceof String s ? s : RouterHandler.mapper().writeValueAsString(value);
                return new ControllerResponse(status, "application/json", body);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize response", e);
            }
        }

        public static ControllerResponse created(Object value) {
            return json(HttpResponseStatus.CREATED, value);
        }

        public static ControllerResponse accepted(Object value) {
            return json(HttpResponseStatus.ACCEPTED, value);
        }

        public static ControllerResponse ok() {
            return json(Map.of("ok", true));
        }

        public static ControllerResponse text(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "text/plain", body);
        }

        public static ControllerResponse error(HttpResponseStatus status, String code, String message) {
            return json(status, new ErrorBody(code, message));
        }
    }

    record ErrorBody(String error, String message) {
    }
}
