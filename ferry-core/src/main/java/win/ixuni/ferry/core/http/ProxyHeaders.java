package win.ixuni.ferry.core.http;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Header names and value conventions shared by the copy and migration layers
 */
public final class ProxyHeaders {

    private ProxyHeaders() {
    }

    // ==================== Copy ====================

    public static final String X_COPY_FROM = "X-Copy-From";
    public static final String X_COPY_FROM_ACCOUNT = "X-Copy-From-Account";
    public static final String DESTINATION = "Destination";
    public static final String DESTINATION_ACCOUNT = "Destination-Account";
    public static final String X_COPIED_FROM = "X-Copied-From";
    public static final String X_COPIED_FROM_ACCOUNT = "X-Copied-From-Account";
    public static final String X_COPIED_FROM_LAST_MODIFIED = "X-Copied-From-Last-Modified";
    public static final String X_FRESH_METADATA = "X-Fresh-Metadata";
    public static final String X_NEWEST = "X-Newest";
    public static final String X_BACKEND_STORAGE_POLICY_INDEX = "X-Backend-Storage-Policy-Index";
    public static final String X_STATIC_LARGE_OBJECT = "X-Static-Large-Object";
    public static final String X_DELETE_AT = "X-Delete-At";
    public static final String ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";

    /**
     * Query parameter selecting the raw manifest of a static large object
     */
    public static final String MULTIPART_MANIFEST = "multipart-manifest";

    // ==================== Migration ====================

    public static final String X_CONTAINER_MIGRATION_PREFIX = "X-Container-Migration-";
    public static final String X_CONTAINER_SYSMETA_MIGRATION_PREFIX = "X-Container-Sysmeta-Migration-";
    public static final String X_CONTAINER_MIGRATION_ACTIVE = "X-Container-Migration-Active";
    public static final String X_CONTAINER_MIGRATION_PROVIDER = "X-Container-Migration-Provider";
    public static final String X_CONTAINER_MIGRATION_SOURCE = "X-Container-Migration-Source";
    public static final String X_MIGRATION_STATUS = "X-Migration-Status";
    public static final String X_OBJECT_SYSMETA_MIGRATION_TIMESTAMP = "X-Object-Sysmeta-Migration-Timestamp";
    public static final String X_OBJECT_SYSMETA_MIGRATION_ORIGIN = "X-Object-Sysmeta-Migration-Origin";

    // ==================== Common ====================

    public static final String X_TIMESTAMP = "X-Timestamp";
    public static final String ETAG = "ETag";

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on", "t", "y");

    /**
     * Lenient boolean parsing used for header and metadata flags
     */
    public static boolean isTrue(String value) {
        return value != null && TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Format as seconds since the epoch with five decimals, e.g. 1402508735.12345
     */
    public static String formatTimestamp(Instant instant) {
        BigDecimal seconds = BigDecimal.valueOf(instant.getEpochSecond())
                .add(BigDecimal.valueOf(instant.getNano(), 9));
        return seconds.setScale(5, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Parse a seconds-since-epoch timestamp
     *
     * @return the instant, {@code null} when the value is absent or malformed
     */
    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            BigDecimal seconds = new BigDecimal(value.trim());
            // longValueExact 拒绝超出 long 的值，ofEpochSecond 拒绝超出 Instant 范围的值
            long whole = seconds.longValueExact();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            return null;
        }
    }
}
