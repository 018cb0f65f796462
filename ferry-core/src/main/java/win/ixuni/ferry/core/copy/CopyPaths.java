package win.ixuni.ferry.core.copy;

import org.springframework.web.util.UriUtils;
import win.ixuni.ferry.core.exception.PreconditionFailedException;
import win.ixuni.ferry.core.http.ProxyRequest;

import java.nio.charset.StandardCharsets;

/**
 * Validation of the path-valued copy headers
 */
public final class CopyPaths {

    private CopyPaths() {
    }

    /**
     * Container and object named by a copy header
     */
    public record Target(String container, String object) {
    }

    /**
     * Parse a {@code X-Copy-From} or {@code Destination} header
     *
     * @throws PreconditionFailedException when the header is not {@code [/]container/object}
     */
    public static Target checkPathHeader(ProxyRequest request, String headerName) {
        String message = headerName + " header must be of the form <container name>/<object name>";
        String value = request.getHeaders().getFirst(headerName);
        if (value == null || value.isEmpty()) {
            throw new PreconditionFailedException(message);
        }
        String path = UriUtils.decode(value, StandardCharsets.UTF_8);
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            throw new PreconditionFailedException(message);
        }
        return new Target(path.substring(0, slash), path.substring(slash + 1));
    }

    /**
     * Validate an account name taken from a header
     *
     * @return the decoded account name
     * @throws PreconditionFailedException when empty or containing slashes
     */
    public static String checkAccountFormat(String account) {
        String decoded = account == null ? "" : UriUtils.decode(account, StandardCharsets.UTF_8);
        if (decoded.isEmpty()) {
            throw new PreconditionFailedException("Account name cannot be empty");
        }
        if (decoded.contains("/")) {
            throw new PreconditionFailedException("Account name cannot contain slashes");
        }
        return decoded;
    }
}
