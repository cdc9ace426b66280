package io.hearthwarrio.formweaver.core;

import io.hearthwarrio.formweaver.core.fill.FillSettings;
import io.hearthwarrio.formweaver.core.match.MatchSettings;
import io.hearthwarrio.formweaver.core.pagination.PaginationSettings;
import io.hearthwarrio.formweaver.core.progress.FillProgressManager;
import io.hearthwarrio.formweaver.core.scan.ScanSettings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * All tunables in one place.
 * <p>
 * {@link #fromEnvironment()} starts from the defaults and applies overrides, system property first, then
 * environment variable:
 * <ul>
 *   <li>{@code formweaver.scan.maxWait} / {@code FORMWEAVER_SCAN_MAX_WAIT} (ms)</li>
 *   <li>{@code formweaver.scan.stableThreshold} / {@code FORMWEAVER_SCAN_STABLE_THRESHOLD}</li>
 *   <li>{@code formweaver.match.threshold} / {@code FORMWEAVER_MATCH_THRESHOLD}</li>
 *   <li>{@code formweaver.fill.elementTimeout} / {@code FORMWEAVER_FILL_ELEMENT_TIMEOUT} (ms)</li>
 *   <li>{@code formweaver.pagination.maxRetries} / {@code FORMWEAVER_PAGINATION_MAX_RETRIES}</li>
 *   <li>{@code formweaver.progress.dir} / {@code FORMWEAVER_PROGRESS_DIR}</li>
 * </ul>
 * Values that do not parse keep the default.
 */
public final class FormWeaverSettings {

    public static final String SCAN_MAX_WAIT = "formweaver.scan.maxWait";
    public static final String SCAN_STABLE_THRESHOLD = "formweaver.scan.stableThreshold";
    public static final String MATCH_THRESHOLD = "formweaver.match.threshold";
    public static final String FILL_ELEMENT_TIMEOUT = "formweaver.fill.elementTimeout";
    public static final String PAGINATION_MAX_RETRIES = "formweaver.pagination.maxRetries";
    public static final String PROGRESS_DIR = "formweaver.progress.dir";

    private final ScanSettings scan;
    private final MatchSettings match;
    private final FillSettings fill;
    private final PaginationSettings pagination;
    private final Path progressDirectory;

    public FormWeaverSettings(
            ScanSettings scan,
            MatchSettings match,
            FillSettings fill,
            PaginationSettings pagination,
            Path progressDirectory
    ) {
        this.scan = Objects.requireNonNull(scan, "scan must not be null");
        this.match = Objects.requireNonNull(match, "match must not be null");
        this.fill = Objects.requireNonNull(fill, "fill must not be null");
        this.pagination = Objects.requireNonNull(pagination, "pagination must not be null");
        this.progressDirectory = Objects.requireNonNull(progressDirectory, "progressDirectory must not be null");
    }

    public static FormWeaverSettings defaults() {
        return new FormWeaverSettings(
                ScanSettings.defaults(),
                MatchSettings.defaults(),
                FillSettings.defaults(),
                PaginationSettings.defaults(),
                FillProgressManager.DEFAULT_DIRECTORY
        );
    }

    public static FormWeaverSettings fromEnvironment() {
        return from(System.getProperties(), System.getenv());
    }

    static FormWeaverSettings from(Properties properties, Map<String, String> env) {
        FormWeaverSettings d = defaults();

        ScanSettings.Builder scan = d.scan.toBuilder();
        Long maxWait = longValue(lookup(SCAN_MAX_WAIT, properties, env));
        if (maxWait != null && maxWait > 0) {
            scan.maxWait(Duration.ofMillis(maxWait));
        }
        Long threshold = longValue(lookup(SCAN_STABLE_THRESHOLD, properties, env));
        if (threshold != null && threshold > 0) {
            scan.stableThreshold(threshold.intValue());
        }

        MatchSettings match = d.match;
        Long matchThreshold = longValue(lookup(MATCH_THRESHOLD, properties, env));
        if (matchThreshold != null && matchThreshold > 0 && matchThreshold <= 100) {
            match = new MatchSettings(matchThreshold.intValue(),
                    Math.max(matchThreshold.intValue(), d.match.getSuggestionThreshold()));
        }

        FillSettings fill = d.fill;
        Long elementTimeout = longValue(lookup(FILL_ELEMENT_TIMEOUT, properties, env));
        if (elementTimeout != null && elementTimeout > 0) {
            fill = fill.withElementTimeout(Duration.ofMillis(elementTimeout));
        }

        PaginationSettings pagination = d.pagination;
        Long retries = longValue(lookup(PAGINATION_MAX_RETRIES, properties, env));
        if (retries != null && retries > 0) {
            pagination = pagination.toBuilder().maxRetries(retries.intValue()).build();
        }

        Path dir = d.progressDirectory;
        String dirValue = lookup(PROGRESS_DIR, properties, env);
        if (!dirValue.isBlank()) {
            dir = Paths.get(dirValue.trim());
        }

        return new FormWeaverSettings(scan.build(), match, fill, pagination, dir);
    }

    /**
     * {@code formweaver.scan.maxWait} maps to {@code FORMWEAVER_SCAN_MAX_WAIT}.
     */
    static String envName(String property) {
        return property.replaceAll("([a-z])([A-Z])", "$1_$2").replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static String lookup(String property, Properties properties, Map<String, String> env) {
        String v = properties.getProperty(property);
        if (v == null || v.isBlank()) {
            v = env.get(envName(property));
        }
        return v == null ? "" : v;
    }

    private static Long longValue(String raw) {
        if (raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public ScanSettings scan() {
        return scan;
    }

    public MatchSettings match() {
        return match;
    }

    public FillSettings fill() {
        return fill;
    }

    public PaginationSettings pagination() {
        return pagination;
    }

    public Path progressDirectory() {
        return progressDirectory;
    }

    public FormWeaverSettings withScan(ScanSettings scan) {
        return new FormWeaverSettings(scan, match, fill, pagination, progressDirectory);
    }

    public FormWeaverSettings withMatch(MatchSettings match) {
        return new FormWeaverSettings(scan, match, fill, pagination, progressDirectory);
    }

    public FormWeaverSettings withFill(FillSettings fill) {
        return new FormWeaverSettings(scan, match, fill, pagination, progressDirectory);
    }

    public FormWeaverSettings withPagination(PaginationSettings pagination) {
        return new FormWeaverSettings(scan, match, fill, pagination, progressDirectory);
    }

    public FormWeaverSettings withProgressDirectory(Path progressDirectory) {
        return new FormWeaverSettings(scan, match, fill, pagination, progressDirectory);
    }

    @Override
    public String toString() {
        return "FormWeaverSettings{" +
                "scanMaxWait=" + scan.getMaxWait().toMillis() + "ms" +
                ", match=" + match +
                ", fill=" + fill +
                ", progressDirectory=" + progressDirectory +
                '}';
    }
}
