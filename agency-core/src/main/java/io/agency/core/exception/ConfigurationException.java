package io.agency.core.exception;

import java.io.Serial;

/// Invalid workflow definition or a request the current configuration forbids.
///
/// Always raised synchronously, before any snapshot is written.
public class ConfigurationException extends AgencyException {

    @Serial private static final long serialVersionUID = 5298017734652011390L;

    public ConfigurationException(String message) {
        super(message);
    }
}
