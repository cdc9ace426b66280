package io.hearthwarrio.formweaver.webdriver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Browser-side probe scripts bundled as classpath resources.
 * <p>
 * Every script is returned with the shared helpers ({@code common.js}) prepended, ready for
 * {@link org.openqa.selenium.JavascriptExecutor#executeScript(String, Object...)}.
 */
public final class ProbeScripts {

    static final String SCAN_CONTROLS = "scan-controls";
    static final String ELEMENT_CONTEXT = "element-context";
    static final String LIST_FRAMES = "list-frames";
    static final String LOADING = "loading";
    static final String COUNT_ROWS = "count-rows";
    static final String COUNT_CONTROLS = "count-controls";
    static final String INSPECT_CONTROL = "inspect-control";
    static final String NAVIGATION_CANDIDATES = "navigation-candidates";
    static final String TABLE_COLUMNS = "table-columns";
    static final String NEAR_TEXT = "near-text";
    static final String SET_VALUE = "set-value";
    static final String DISPATCH_EVENT = "dispatch-event";
    static final String FOCUS = "focus";
    static final String HIGHLIGHT = "highlight";
    static final String CLICK = "click";

    private static final String COMMON = "common";
    private static final String BASE = "probe/";

    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private ProbeScripts() {
        // utility class
    }

    /**
     * @param name script name without extension
     * @return script source including shared helpers
     * @throws IllegalStateException when the resource is missing
     */
    public static String get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return CACHE.computeIfAbsent(name, n -> read(COMMON) + "\n" + read(n));
    }

    private static String read(String name) {
        String path = BASE + name + ".js";
        try (InputStream in = ProbeScripts.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Probe script not found on classpath: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read probe script " + path, e);
        }
    }
}
