package io.agency.server.validation;

/// Strips line breaks from user-supplied values before they are logged, so a
/// crafted workflow id or reason cannot forge extra log lines.
///
/// ```
/// LOG.infov("Suspend requested: workflow={0}", LogSanitizer.sanitize(workflowId));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// @param value the string to sanitize, may be null
    /// @return the value without `\r` and `\n`, or `"null"` for null input
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }
}
