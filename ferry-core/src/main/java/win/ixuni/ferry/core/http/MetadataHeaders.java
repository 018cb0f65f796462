package win.ixuni.ferry.core.http;

import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * User and system metadata header helpers
 * <p>
 * User metadata travels as {@code X-<Type>-Meta-*}, system metadata as
 * {@code X-<Type>-Sysmeta-*}, where type is "object", "container" or "account".
 */
public final class MetadataHeaders {

    private MetadataHeaders() {
    }

    public static final String OBJECT = "object";
    public static final String CONTAINER = "container";

    public static String userMetaPrefix(String serverType) {
        return "x-" + serverType.toLowerCase(Locale.ROOT) + "-meta-";
    }

    public static String sysMetaPrefix(String serverType) {
        return "x-" + serverType.toLowerCase(Locale.ROOT) + "-sysmeta-";
    }

    public static boolean isUserMeta(String serverType, String key) {
        return key != null && key.toLowerCase(Locale.ROOT).startsWith(userMetaPrefix(serverType));
    }

    public static boolean isSysMeta(String serverType, String key) {
        return key != null && key.toLowerCase(Locale.ROOT).startsWith(sysMetaPrefix(serverType));
    }

    public static boolean isSysOrUserMeta(String serverType, String key) {
        return isUserMeta(serverType, key) || isSysMeta(serverType, key);
    }

    /**
     * Object metadata plus the headers that must survive a copy
     */
    public static boolean isCopiedObjectHeader(String key) {
        return isSysOrUserMeta(OBJECT, key) || ProxyHeaders.X_DELETE_AT.equalsIgnoreCase(key);
    }

    /**
     * Copy object user/sys metadata and X-Delete-At from one header set to another,
     * overwriting existing values
     */
    public static void copyHeadersInto(HttpHeaders from, HttpHeaders to) {
        copyHeaderSubset(from, to, MetadataHeaders::isCopiedObjectHeader);
    }

    public static void copyHeaderSubset(HttpHeaders from, HttpHeaders to, Predicate<String> condition) {
        from.forEach((key, values) -> {
            if (condition.test(key)) {
                to.put(key, new ArrayList<>(values));
            }
        });
    }

    public static void removeItems(HttpHeaders headers, Predicate<String> condition) {
        List<String> doomed = headers.keySet().stream().filter(condition).toList();
        doomed.forEach(headers::remove);
    }
}
