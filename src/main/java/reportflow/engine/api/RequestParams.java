package reportflow.engine.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import reportflow.engine.exception.ValidationException;

import java.util.List;

/**
 * Query-string access for controllers.
 */
public final class RequestParams {

    private final QueryStringDecoder decoder;

    private RequestParams(String uri) {
        this.decoder = new QueryStringDecoder(uri);
    }

    public static RequestParams of(FullHttpRequest req) {
        return new RequestParams(req.uri());
    }

    /**
     * Non-negative integer parameter.
     *
     * @throws ValidationException if the value is not a non-negative integer
     */
    public int intParam(String name, int defaultValue) {
        List<String> values = decoder.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return defaultValue;
        }
        String raw = values.get(0);
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new ValidationException(name, raw, name + " must not be negative");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException(name, raw, name + " must be an integer");
        }
    }
}
