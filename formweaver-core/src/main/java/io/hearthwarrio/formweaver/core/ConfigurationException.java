package io.hearthwarrio.formweaver.core;

/**
 * Thrown when a session cannot start: no source rows, no field mappings,
 * or an anchor column without a usable row selector.
 */
public class ConfigurationException extends FormWeaverException {
    public ConfigurationException(String message) {
        super(FailureKind.CONFIGURATION_ERROR, message);
    }
}
