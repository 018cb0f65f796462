package win.ixuni.ferry.core.http;

import lombok.Value;

import java.util.Optional;

/**
 * Decomposed request path {@code /version/account[/container[/object]]}
 * <p>
 * The object segment keeps any embedded slashes. Also used as the source
 * path of copy and migration operations, which may point at another account.
 */
@Value
public class RequestPath {

    String version;
    String account;
    String container;
    String object;

    /**
     * 解析请求路径
     *
     * @param path decoded path, must start with '/'
     * @return the parsed path, empty when version or account is missing or a
     *         leading segment is empty
     */
    public static Optional<RequestPath> parse(String path) {
        if (path == null || !path.startsWith("/")) {
            return Optional.empty();
        }
        String[] segs = path.substring(1).split("/", 4);
        if (segs.length < 2 || segs[0].isEmpty() || segs[1].isEmpty()) {
            return Optional.empty();
        }
        String container = segs.length > 2 ? segs[2] : null;
        String object = segs.length > 3 ? segs[3] : null;
        if (container != null && container.isEmpty()) {
            if (object != null && !object.isEmpty()) {
                // "/v1/a//o"
                return Optional.empty();
            }
            container = null;
        }
        if (object != null && object.isEmpty()) {
            object = null;
        }
        return Optional.of(new RequestPath(segs[0], segs[1], container, object));
    }

    public static RequestPath of(String version, String account, String container, String object) {
        return new RequestPath(version, account, container, object);
    }

    public boolean isObject() {
        return container != null && object != null;
    }

    public boolean isContainer() {
        return container != null && object == null;
    }

    /**
     * Path of the owning container
     */
    public String containerPath() {
        return "/" + version + "/" + account + "/" + container;
    }

    /**
     * {@code container/object}
     */
    public String containerAndObject() {
        return container + "/" + object;
    }

    public String toPath() {
        StringBuilder sb = new StringBuilder("/").append(version).append('/').append(account);
        if (container != null) {
            sb.append('/').append(container);
            if (object != null) {
                sb.append('/').append(object);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toPath();
    }
}
