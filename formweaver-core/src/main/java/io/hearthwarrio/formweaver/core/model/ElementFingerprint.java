package io.hearthwarrio.formweaver.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable description of one discovered data-entry control.
 * <p>
 * A fingerprint carries everything needed to find the control again:
 * <ul>
 *   <li>candidate locators, kept in {@link LocatorKind} priority order</li>
 *   <li>semantic anchors: label, placeholder, aria-label, nearby text and framework form-label text</li>
 *   <li>structural features: tag, type, id, name, classes, bounding box</li>
 *   <li>optional table context and frame context</li>
 *   <li>optional sibling locators when one logical field spans several repeated controls</li>
 * </ul>
 * <p>
 * The stability score is computed once from which anchors are present. Tagging a fingerprint with a
 * frame or with siblings returns a new instance.
 */
public final class ElementFingerprint {

    private static final Pattern TABLE_ROW_STEP = Pattern.compile("tr\\[(\\d+)]");
    private static final Pattern DIV_ROW_STEP = Pattern.compile("div\\[(\\d+)]");

    private final List<Locator> locators;
    private final String label;
    private final String placeholder;
    private final String ariaLabel;
    private final String nearbyText;
    private final String formLabel;
    private final String tag;
    private final String type;
    private final String id;
    private final String name;
    private final List<String> classes;
    private final BoundingBox bounds;
    private final TableContext table;
    private final FrameContext frame;
    private final List<Locator> siblings;
    private final int stabilityScore;

    private ElementFingerprint(Builder b) {
        List<Locator> sorted = new ArrayList<>(b.locators);
        sorted.sort(Comparator.comparing(Locator::getKind));
        this.locators = List.copyOf(sorted);
        this.label = b.label;
        this.placeholder = b.placeholder;
        this.ariaLabel = b.ariaLabel;
        this.nearbyText = b.nearbyText;
        this.formLabel = b.formLabel;
        this.tag = b.tag.toLowerCase(Locale.ROOT);
        this.type = b.type.toLowerCase(Locale.ROOT);
        this.id = b.id;
        this.name = b.name;
        this.classes = List.copyOf(b.classes);
        this.bounds = b.bounds;
        this.table = b.table;
        this.frame = b.frame;
        this.siblings = List.copyOf(b.siblings);
        this.stabilityScore = computeStability();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this fingerprint's attributes.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.locators.addAll(locators);
        b.label = label;
        b.placeholder = placeholder;
        b.ariaLabel = ariaLabel;
        b.nearbyText = nearbyText;
        b.formLabel = formLabel;
        b.tag = tag;
        b.type = type;
        b.id = id;
        b.name = name;
        b.classes.addAll(classes);
        b.bounds = bounds;
        b.table = table;
        b.frame = frame;
        b.siblings.addAll(siblings);
        return b;
    }

    private int computeStability() {
        int score = 0;
        if (locator(LocatorKind.ID).isPresent()) {
            score += 40;
        }
        if (!ariaLabel.isBlank()) {
            score += 35;
        }
        if (!formLabel.isBlank()) {
            score += 25;
        }
        if (!name.isBlank()) {
            score += 20;
        }
        if (!label.isBlank()) {
            score += 15;
        }
        if (!classes.isEmpty()) {
            score += 10;
        }
        return Math.min(score, 100);
    }

    public List<Locator> getLocators() {
        return locators;
    }

    public String getLabel() {
        return label;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public String getAriaLabel() {
        return ariaLabel;
    }

    public String getNearbyText() {
        return nearbyText;
    }

    public String getFormLabel() {
        return formLabel;
    }

    public String getTag() {
        return tag;
    }

    public String getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<String> getClasses() {
        return classes;
    }

    public Optional<BoundingBox> getBounds() {
        return Optional.ofNullable(bounds);
    }

    public Optional<TableContext> getTable() {
        return Optional.ofNullable(table);
    }

    public FrameContext getFrame() {
        return frame;
    }

    public List<Locator> getSiblings() {
        return siblings;
    }

    public int getStabilityScore() {
        return stabilityScore;
    }

    public boolean isInTable() {
        return table != null;
    }

    public boolean isGroup() {
        return !siblings.isEmpty();
    }

    /**
     * Number of controls this logical field spans: the primary control plus its siblings.
     */
    public int groupSize() {
        return 1 + siblings.size();
    }

    public Optional<Locator> locator(LocatorKind kind) {
        for (Locator l : locators) {
            if (l.getKind() == kind) {
                return Optional.of(l);
            }
        }
        return Optional.empty();
    }

    /**
     * First present locator in priority order.
     */
    public Optional<Locator> bestLocator() {
        return locators.isEmpty() ? Optional.empty() : Optional.of(locators.get(0));
    }

    /**
     * Label shown to users: aria-label, form label, label, placeholder, name, id, then {@code [tag]}.
     */
    public String displayName() {
        for (String candidate : List.of(ariaLabel, formLabel, label, placeholder, name, id)) {
            if (!candidate.isBlank()) {
                return candidate;
            }
        }
        return "[" + tag + "]";
    }

    /**
     * Label used to detect near-duplicates: label, form label, column header, placeholder, name, id.
     *
     * @return base label or an empty string when the control has no text anchor at all
     */
    public String baseLabel() {
        String header = table == null ? "" : table.getColumnHeader();
        for (String candidate : List.of(label, formLabel, header, placeholder, name, id)) {
            if (!candidate.isBlank()) {
                return candidate;
            }
        }
        return "";
    }

    public ControlKind controlKind() {
        if ("select".equals(tag)) {
            return ControlKind.CHOICE;
        }
        if ("input".equals(tag) && ("checkbox".equals(type) || "radio".equals(type))) {
            return ControlKind.BOOLEAN;
        }
        if ("input".equals(tag) || "textarea".equals(tag)) {
            return ControlKind.TEXT;
        }
        return ControlKind.RICH_TEXT;
    }

    public boolean isDateInput() {
        return type.contains("date");
    }

    /**
     * Structural locator of the same column in another table row.
     * <p>
     * The innermost {@code tr[N]} step is replaced with {@code tr[row + 1]}. A path without an indexed
     * {@code tr} falls back to an unindexed {@code /tr/} step, then to the innermost {@code div[N]} when the
     * path mentions a row container.
     *
     * @param row 0-based row index
     */
    public Optional<Locator> rowLocator(int row) {
        if (row < 0) {
            throw new IllegalArgumentException("row must not be negative");
        }
        Optional<Locator> xpath = locator(LocatorKind.XPATH);
        if (xpath.isEmpty()) {
            return Optional.empty();
        }
        String path = xpath.get().getValue();
        String index = String.valueOf(row + 1);

        int[] tr = lastIndexGroup(TABLE_ROW_STEP, path);
        if (tr != null) {
            return Optional.of(Locator.xpath(path.substring(0, tr[0]) + index + path.substring(tr[1])));
        }
        int plain = path.lastIndexOf("/tr/");
        if (plain >= 0) {
            return Optional.of(Locator.xpath(path.substring(0, plain + 3) + "[" + index + "]" + path.substring(plain + 3)));
        }
        if (path.toLowerCase(Locale.ROOT).contains("row")) {
            int[] div = lastIndexGroup(DIV_ROW_STEP, path);
            if (div != null) {
                return Optional.of(Locator.xpath(path.substring(0, div[0]) + index + path.substring(div[1])));
            }
        }
        return Optional.empty();
    }

    /**
     * Structural XPath with the innermost row index removed, matching the same column in every row.
     */
    public Optional<String> genericRowXPath() {
        Optional<Locator> xpath = locator(LocatorKind.XPATH);
        if (xpath.isEmpty()) {
            return Optional.empty();
        }
        String path = xpath.get().getValue();
        int[] tr = lastIndexGroup(TABLE_ROW_STEP, path);
        if (tr != null) {
            return Optional.of(path.substring(0, tr[0] - 1) + path.substring(tr[1] + 1));
        }
        if (!path.contains("/tr/") && path.toLowerCase(Locale.ROOT).contains("row")) {
            int[] div = lastIndexGroup(DIV_ROW_STEP, path);
            if (div != null) {
                return Optional.of(path.substring(0, div[0] - 1) + path.substring(div[1] + 1));
            }
        }
        return Optional.of(path);
    }

    public ElementFingerprint withFrame(FrameContext frame) {
        return toBuilder().frame(frame).build();
    }

    public ElementFingerprint withSiblings(List<Locator> siblings) {
        Builder b = toBuilder();
        b.siblings.clear();
        b.siblings.addAll(Objects.requireNonNull(siblings, "siblings must not be null"));
        return b.build();
    }

    /**
     * @return start and end of the digits inside the last {@code [N]} step matched by the pattern, or null
     */
    private static int[] lastIndexGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int[] last = null;
        while (m.find()) {
            last = new int[]{m.start(1), m.end(1)};
        }
        return last;
    }

    @Override
    public String toString() {
        return "ElementFingerprint{" +
                "name='" + displayName() + '\'' +
                ", tag=" + tag +
                (type.isEmpty() ? "" : ", type=" + type) +
                ", stability=" + stabilityScore +
                ", locators=" + locators +
                (table == null ? "" : ", " + table) +
                (frame.isTop() ? "" : ", frame=" + frame) +
                (siblings.isEmpty() ? "" : ", siblings=" + siblings.size()) +
                '}';
    }

    public static final class Builder {
        private final List<Locator> locators = new ArrayList<>();
        private String label = "";
        private String placeholder = "";
        private String ariaLabel = "";
        private String nearbyText = "";
        private String formLabel = "";
        private String tag = "input";
        private String type = "";
        private String id = "";
        private String name = "";
        private final List<String> classes = new ArrayList<>();
        private BoundingBox bounds;
        private TableContext table;
        private FrameContext frame = FrameContext.TOP;
        private final List<Locator> siblings = new ArrayList<>();

        private Builder() {
        }

        public Builder locator(Locator locator) {
            Objects.requireNonNull(locator, "locator must not be null");
            if (!locators.contains(locator)) {
                locators.add(locator);
            }
            return this;
        }

        public Builder label(String label) {
            this.label = normalize(label);
            return this;
        }

        public Builder placeholder(String placeholder) {
            this.placeholder = normalize(placeholder);
            return this;
        }

        public Builder ariaLabel(String ariaLabel) {
            this.ariaLabel = normalize(ariaLabel);
            return this;
        }

        public Builder nearbyText(String nearbyText) {
            this.nearbyText = normalize(nearbyText);
            return this;
        }

        public Builder formLabel(String formLabel) {
            this.formLabel = normalize(formLabel);
            return this;
        }

        public Builder tag(String tag) {
            String t = normalize(tag);
            this.tag = t.isEmpty() ? "input" : t;
            return this;
        }

        public Builder type(String type) {
            this.type = normalize(type);
            return this;
        }

        public Builder id(String id) {
            this.id = normalize(id);
            return this;
        }

        public Builder name(String name) {
            this.name = normalize(name);
            return this;
        }

        public Builder classes(List<String> classes) {
            this.classes.clear();
            if (classes != null) {
                for (String c : classes) {
                    if (c != null && !c.isBlank()) {
                        this.classes.add(c.trim());
                    }
                }
            }
            return this;
        }

        public Builder bounds(BoundingBox bounds) {
            this.bounds = bounds;
            return this;
        }

        public Builder table(TableContext table) {
            this.table = table;
            return this;
        }

        public Builder frame(FrameContext frame) {
            this.frame = frame == null ? FrameContext.TOP : frame;
            return this;
        }

        public Builder sibling(Locator sibling) {
            this.siblings.add(Objects.requireNonNull(sibling, "sibling must not be null"));
            return this;
        }

        public ElementFingerprint build() {
            return new ElementFingerprint(this);
        }

        private static String normalize(String s) {
            return s == null ? "" : s.trim();
        }
    }
}
