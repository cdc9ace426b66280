package io.hearthwarrio.formweaver.core.session;

import io.hearthwarrio.formweaver.core.anchor.AnchorConfig;
import io.hearthwarrio.formweaver.core.fill.FillMode;
import io.hearthwarrio.formweaver.core.model.Locator;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-session options.
 * <p>
 * A key field (set directly or through the primary pair of an {@link AnchorConfig}) switches the session to
 * anchor correlation; without one, rows are paired with page rows by position.
 */
public final class FillSessionConfig {

    private final FillMode fillMode;
    private final PaginationMode paginationMode;
    private final String keyField;
    private final AnchorConfig anchorConfig;
    private final Locator nextPageControl;
    private final String sourceId;
    private final boolean rebindAfterPageTurn;

    private FillSessionConfig(Builder b) {
        this.fillMode = b.fillMode;
        this.paginationMode = b.paginationMode;
        this.keyField = b.keyField;
        this.anchorConfig = b.anchorConfig;
        this.nextPageControl = b.nextPageControl;
        this.sourceId = b.sourceId;
        this.rebindAfterPageTurn = b.rebindAfterPageTurn;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FillMode getFillMode() {
        return fillMode;
    }

    public PaginationMode getPaginationMode() {
        return paginationMode;
    }

    /**
     * Explicit key field, else the source field of the anchor configuration's primary pair.
     */
    public Optional<String> keyField() {
        if (keyField != null && !keyField.isBlank()) {
            return Optional.of(keyField);
        }
        if (anchorConfig != null) {
            return anchorConfig.primary().map(p -> p.getSourceField());
        }
        return Optional.empty();
    }

    public Optional<AnchorConfig> getAnchorConfig() {
        return Optional.ofNullable(anchorConfig);
    }

    public Optional<Locator> getNextPageControl() {
        return Optional.ofNullable(nextPageControl);
    }

    public String getSourceId() {
        return sourceId;
    }

    /**
     * Whether mappings are re-pointed at freshly scanned controls after each page turn.
     */
    public boolean isRebindAfterPageTurn() {
        return rebindAfterPageTurn;
    }

    @Override
    public String toString() {
        return "FillSessionConfig{" +
                "fillMode=" + fillMode +
                ", pagination=" + paginationMode +
                ", key=" + keyField().orElse("-") +
                ", source='" + sourceId + '\'' +
                '}';
    }

    public static final class Builder {
        private FillMode fillMode = FillMode.SINGLE_RECORD;
        private PaginationMode paginationMode = PaginationMode.MANUAL;
        private String keyField;
        private AnchorConfig anchorConfig;
        private Locator nextPageControl;
        private String sourceId = "source";
        private boolean rebindAfterPageTurn = true;

        private Builder() {
        }

        public Builder fillMode(FillMode fillMode) {
            this.fillMode = Objects.requireNonNull(fillMode, "fillMode must not be null");
            return this;
        }

        public Builder paginationMode(PaginationMode paginationMode) {
            this.paginationMode = Objects.requireNonNull(paginationMode, "paginationMode must not be null");
            return this;
        }

        public Builder keyField(String keyField) {
            this.keyField = keyField;
            return this;
        }

        public Builder anchorConfig(AnchorConfig anchorConfig) {
            this.anchorConfig = anchorConfig;
            return this;
        }

        public Builder nextPageControl(Locator nextPageControl) {
            this.nextPageControl = nextPageControl;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId == null || sourceId.isBlank() ? "source" : sourceId;
            return this;
        }

        public Builder rebindAfterPageTurn(boolean rebindAfterPageTurn) {
            this.rebindAfterPageTurn = rebindAfterPageTurn;
            return this;
        }

        public FillSessionConfig build() {
            return new FillSessionConfig(this);
        }
    }
}
