package gamefleet.http;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Route template such as {@code /api/v1/spokes/{id}/commands}.
 * A {@code {name}} segment matches exactly one non-empty path segment.
 */
public final class PathPattern {

    private final String template;
    private final String[] segments;

    private PathPattern(String template) {
        this.template = template;
        this.segments = split(template);
    }

    public static PathPattern of(String template) {
        return new PathPattern(template);
    }

    public boolean matches(String path) {
        return match(path).isPresent();
    }

    /**
     * @return decoded path variables, or empty when the path does not fit the template
     */
    public Optional<Map<String, String>> match(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String[] parts = split(path);
        if (parts.length != segments.length) {
            return Optional.empty();
        }
        Map<String, String> variables = new LinkedHashMap<>();
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (segment.startsWith("{") && segment.endsWith("}")) {
                if (parts[i].isEmpty()) {
                    return Optional.empty();
                }
                variables.put(segment.substring(1, segment.length() - 1),
                        URLDecoder.decode(parts[i], StandardCharsets.UTF_8));
            } else if (!segment.equals(parts[i])) {
                return Optional.empty();
            }
        }
        return Optional.of(variables);
    }

    /**
     * @throws IllegalArgumentException when the path does not fit
     */
    public String variable(String path, String name) {
        return match(path)
                .map(v -> v.get(name))
                .orElseThrow(() -> new IllegalArgumentException(path + " does not match " + template));
    }

    private static String[] split(String path) {
        String trimmed = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
        return trimmed.split("/", -1);
    }

    @Override
    public String toString() {
        return template;
    }
}
