package io.hearthwarrio.formweaver.webdriver;

import io.hearthwarrio.formweaver.core.ElementNotFoundException;
import io.hearthwarrio.formweaver.core.FrameUnreachableException;
import io.hearthwarrio.formweaver.core.ProbeException;
import io.hearthwarrio.formweaver.core.browser.BrowserHandle;
import io.hearthwarrio.formweaver.core.browser.ChoiceOption;
import io.hearthwarrio.formweaver.core.browser.ControlState;
import io.hearthwarrio.formweaver.core.browser.DomEvent;
import io.hearthwarrio.formweaver.core.browser.FrameDescriptor;
import io.hearthwarrio.formweaver.core.browser.NavigationCandidate;
import io.hearthwarrio.formweaver.core.browser.ProbeResult;
import io.hearthwarrio.formweaver.core.browser.WebColumn;
import io.hearthwarrio.formweaver.core.model.ElementFingerprint;
import io.hearthwarrio.formweaver.core.model.Locator;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.hearthwarrio.formweaver.webdriver.FingerprintMapper.num;
import static io.hearthwarrio.formweaver.webdriver.FingerprintMapper.str;

/**
 * {@link BrowserHandle} backed by a Selenium {@link WebDriver}.
 * <p>
 * Page inspection runs the bundled probe scripts (see {@link ProbeScripts}); interactions use native
 * WebDriver calls where they exist and scripts otherwise.
 * <p>
 * Element lookups honour the driver's implicit wait, so every miss costs that long. Keep it short:
 * fill sessions run their own bounded waits.
 * <p>
 * This class is not thread-safe and is expected to be used from a single thread, like the driver itself.
 * The driver's lifecycle stays with the caller.
 */
public class SeleniumBrowserHandle implements BrowserHandle {

    private static final String FALLBACK_SELECTOR = "input, select, textarea";

    private static final Set<String> SKIPPED_INPUT_TYPES = Set.of(
            "hidden", "button", "submit", "reset", "image", "file"
    );

    private final WebDriver driver;
    private final JavascriptExecutor js;
    private final FingerprintMapper mapper;

    public SeleniumBrowserHandle(WebDriver driver) {
        this(driver, new FingerprintMapper());
    }

    public SeleniumBrowserHandle(WebDriver driver, FingerprintMapper mapper) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor");
        }
        this.js = (JavascriptExecutor) driver;
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public WebDriver getDriver() {
        return driver;
    }

    // ----------- probing -----------

    @Override
    public ProbeResult probeControls() {
        Map<?, ?> result = asMap(ProbeScripts.SCAN_CONTROLS, run(ProbeScripts.SCAN_CONTROLS));
        if (Boolean.TRUE.equals(result.get("loading"))) {
            return ProbeResult.loading();
        }
        return ProbeResult.of(mapper.fromProbe(asList(result.get("elements"))));
    }

    @Override
    public List<ElementFingerprint> probeControlsFallback() {
        List<WebElement> elements;
        try {
            elements = driver.findElements(By.cssSelector(FALLBACK_SELECTOR));
        } catch (WebDriverException e) {
            throw new ProbeException("Fallback scan failed", e);
        }

        List<ElementFingerprint> out = new ArrayList<>();
        for (WebElement element : elements) {
            try {
                String type = str(element.getAttribute("type")).toLowerCase(Locale.ROOT);
                if (SKIPPED_INPUT_TYPES.contains(type) || !element.isDisplayed()) {
                    continue;
                }
                Object context = run(ProbeScripts.ELEMENT_CONTEXT, element);
                ElementFingerprint fp = mapper.fromElement(element, context instanceof Map ? (Map<?, ?>) context : null);
                if (!fp.getLocators().isEmpty()) {
                    out.add(fp);
                }
            } catch (StaleElementReferenceException e) {
                // element left the page while scanning; the next snapshot will not contain it either
                continue;
            }
        }
        return out;
    }

    @Override
    public List<FrameDescriptor> listChildFrames() {
        List<FrameDescriptor> out = new ArrayList<>();
        for (Object o : asList(run(ProbeScripts.LIST_FRAMES))) {
            if (o instanceof Map) {
                Map<?, ?> m = (Map<?, ?>) o;
                out.add(new FrameDescriptor(num(m.get("index")), str(m.get("src")), num(m.get("width")), num(m.get("height"))));
            }
        }
        return out;
    }

    @Override
    public String currentUrl() {
        return str(driver.getCurrentUrl());
    }

    @Override
    public boolean isLoadingIndicatorVisible() {
        return Boolean.TRUE.equals(run(ProbeScripts.LOADING));
    }

    @Override
    public int countTableRows() {
        return num(run(ProbeScripts.COUNT_ROWS));
    }

    @Override
    public int countInteractiveControls() {
        return num(run(ProbeScripts.COUNT_CONTROLS));
    }

    @Override
    public List<String> readColumnValues(String xpath) {
        Objects.requireNonNull(xpath, "xpath must not be null");
        List<String> out = new ArrayList<>();
        for (WebElement element : findAll(By.xpath(xpath))) {
            out.add(valueOf(element));
        }
        return out;
    }

    @Override
    public String firstText(List<String> cssSelectors) {
        if (cssSelectors == null) {
            return "";
        }
        for (String selector : cssSelectors) {
            if (selector == null || selector.isBlank()) {
                continue;
            }
            for (WebElement element : findAll(By.cssSelector(selector))) {
                if (element.isDisplayed()) {
                    String text = str(element.getText());
                    if (!text.isEmpty()) {
                        return text;
                    }
                }
            }
        }
        return "";
    }

    @Override
    public String firstInputValue(String cssSelector) {
        Objects.requireNonNull(cssSelector, "cssSelector must not be null");
        List<WebElement> found = findAll(By.cssSelector(cssSelector));
        return found.isEmpty() ? "" : str(found.get(0).getAttribute("value"));
    }

    @Override
    public Optional<ControlState> inspectControl(Locator locator) {
        List<WebElement> found = findAll(Locators.toBy(locator));
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Map<?, ?> m = asMap(ProbeScripts.INSPECT_CONTROL, run(ProbeScripts.INSPECT_CONTROL, found.get(0)));
        Object opacity = m.get("opacity");
        return Optional.of(new ControlState(
                m.get("disabled") == null ? null : str(m.get("disabled")),
                m.get("ariaDisabled") == null ? null : str(m.get("ariaDisabled")),
                str(m.get("classes")),
                str(m.get("pointerEvents")),
                opacity instanceof Number ? ((Number) opacity).doubleValue() : 1.0,
                str(m.get("text"))
        ));
    }

    @Override
    public List<NavigationCandidate> listNavigationCandidates(List<String> keywords) {
        List<String> words = keywords == null ? Collections.emptyList() : keywords;
        List<NavigationCandidate> out = new ArrayList<>();
        for (Object o : asList(run(ProbeScripts.NAVIGATION_CANDIDATES, words))) {
            if (o instanceof Map) {
                Map<?, ?> m = (Map<?, ?>) o;
                String xpath = str(m.get("xpath"));
                if (!xpath.isEmpty()) {
                    out.add(new NavigationCandidate(str(m.get("text")), str(m.get("tag")), Locator.xpath(xpath)));
                }
            }
        }
        return out;
    }

    @Override
    public List<WebColumn> listTableColumns() {
        List<WebColumn> out = new ArrayList<>();
        for (Object o : asList(run(ProbeScripts.TABLE_COLUMNS))) {
            if (o instanceof Map) {
                Map<?, ?> m = (Map<?, ?>) o;
                String xpath = str(m.get("xpath"));
                if (xpath.isEmpty()) {
                    continue;
                }
                List<String> samples = new ArrayList<>();
                for (Object s : asList(m.get("samples"))) {
                    samples.add(str(s));
                }
                out.add(new WebColumn(
                        str(m.get("label")),
                        xpath,
                        Boolean.TRUE.equals(m.get("readOnly")),
                        Boolean.TRUE.equals(m.get("input")),
                        samples
                ));
            }
        }
        return out;
    }

    // ----------- frames -----------

    @Override
    public void enterFrame(List<Integer> path) {
        Objects.requireNonNull(path, "path must not be null");
        leaveFrames();
        for (Integer index : path) {
            try {
                driver.switchTo().frame(index);
            } catch (WebDriverException e) {
                leaveFrames();
                throw new FrameUnreachableException("Cannot enter frame " + path + " at index " + index, e);
            }
        }
    }

    @Override
    public void leaveFrames() {
        driver.switchTo().defaultContent();
    }

    // ----------- writing -----------

    @Override
    public boolean isPresent(Locator locator, Duration timeout) {
        By by = Locators.toBy(locator);
        if (!findAll(by).isEmpty()) {
            return true;
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return false;
        }
        try {
            return new WebDriverWait(driver, timeout).until(d -> !d.findElements(by).isEmpty());
        } catch (TimeoutException e) {
            return false;
        }
    }

    @Override
    public void focus(Locator locator) {
        run(ProbeScripts.FOCUS, find(locator));
    }

    @Override
    public void clear(Locator locator) {
        WebElement element = find(locator);
        if (isNativeControl(element)) {
            element.clear();
        }
    }

    @Override
    public void assignValue(Locator locator, String value) {
        run(ProbeScripts.SET_VALUE, find(locator), value == null ? "" : value);
    }

    @Override
    public void dispatch(Locator locator, DomEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        run(ProbeScripts.DISPATCH_EVENT, find(locator), event.getDomName());
    }

    @Override
    public List<ChoiceOption> readOptions(Locator locator) {
        WebElement element = find(locator);
        if (!"select".equalsIgnoreCase(element.getTagName())) {
            return Collections.emptyList();
        }
        List<WebElement> options = new Select(element).getOptions();
        List<ChoiceOption> out = new ArrayList<>(options.size());
        for (int i = 0; i < options.size(); i++) {
            WebElement option = options.get(i);
            out.add(new ChoiceOption(i, option.getAttribute("value"), option.getText()));
        }
        return out;
    }

    @Override
    public void selectOption(Locator locator, int optionIndex) {
        new Select(find(locator)).selectByIndex(optionIndex);
    }

    @Override
    public boolean isChecked(Locator locator) {
        return find(locator).isSelected();
    }

    @Override
    public void toggle(Locator locator) {
        click(locator);
    }

    @Override
    public void clearAndType(Locator locator, String value) {
        WebElement element = find(locator);
        element.clear();
        element.sendKeys(value == null ? "" : value);
    }

    @Override
    public void click(Locator locator) {
        WebElement element = find(locator);
        try {
            element.click();
        } catch (ElementClickInterceptedException e) {
            // overlays (sticky headers, tooltips) intercept native clicks; the DOM click still reaches the element
            run(ProbeScripts.CLICK, element);
        }
    }

    @Override
    public Optional<Locator> locateNearText(String text, int maxCandidates) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String xpath = str(run(ProbeScripts.NEAR_TEXT, text.trim(), Math.max(1, maxCandidates)));
        return xpath.isEmpty() ? Optional.empty() : Optional.of(Locator.xpath(xpath));
    }

    @Override
    public void highlight(Locator locator) {
        run(ProbeScripts.HIGHLIGHT, find(locator));
    }

    // ----------- internals -----------

    private WebElement find(Locator locator) {
        List<WebElement> found = findAll(Locators.toBy(locator));
        if (found.isEmpty()) {
            throw new ElementNotFoundException("No element matches " + locator);
        }
        return found.get(0);
    }

    private List<WebElement> findAll(By by) {
        try {
            return driver.findElements(by);
        } catch (InvalidSelectorException e) {
            throw new ProbeException("Invalid selector " + by, e);
        }
    }

    private Object run(String script, Object... args) {
        try {
            return js.executeScript(ProbeScripts.get(script), args);
        } catch (StaleElementReferenceException e) {
            throw e;
        } catch (WebDriverException e) {
            throw new ProbeException("Probe script '" + script + "' failed: " + firstLine(e.getMessage()), e);
        }
    }

    private static String valueOf(WebElement element) {
        if (isNativeControl(element)) {
            return str(element.getAttribute("value"));
        }
        return str(element.getText());
    }

    private static boolean isNativeControl(WebElement element) {
        String tag = str(element.getTagName()).toLowerCase(Locale.ROOT);
        return "input".equals(tag) || "textarea".equals(tag) || "select".equals(tag);
    }

    private static Map<?, ?> asMap(String script, Object value) {
        if (value instanceof Map) {
            return (Map<?, ?>) value;
        }
        throw new ProbeException("Probe script '" + script + "' returned " + (value == null ? "nothing" : value.getClass().getSimpleName()));
    }

    private static List<?> asList(Object value) {
        return value instanceof List ? (List<?>) value : Collections.emptyList();
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
