package io.hearthwarrio.formweaver.core.fill;

import io.hearthwarrio.formweaver.core.model.ElementFingerprint;

/**
 * Adapts a source value to the control it is written to.
 */
public final class ValueTransformer {

    /**
     * Date inputs expect {@code yyyy-MM-dd}; spreadsheets often deliver {@code yyyy/MM/dd}.
     */
    public String transform(ElementFingerprint fingerprint, String value) {
        if (value == null) {
            return "";
        }
        if (fingerprint.isDateInput()) {
            return value.trim().replace('/', '-');
        }
        return value;
    }
}
