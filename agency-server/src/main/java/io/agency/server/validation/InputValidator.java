package io.agency.server.validation;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/// Input predicates shared by the validators at the REST boundary.
///
/// ### Identifiers
/// Workflow ids become file names and SQL keys, so they start with an
/// alphanumeric character, contain only `[A-Za-z0-9._-]` and are at most
/// 255 characters.
///
/// ### Free Text
/// Messages may carry TAB, LF and CR but no other C0 control character or DEL.
///
/// @see ValidIdValidator
/// @see ValidMessageValidator
public final class InputValidator {

    static final Pattern SAFE_ID = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{0,254}");

    static final Pattern DANGEROUS_CONTROL =
            Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    /// Default upper bound for a message in UTF-8 bytes (256 KiB).
    public static final int MAX_MESSAGE_BYTES = 262_144;

    private InputValidator() {}

    public static boolean isSafeId(String value) {
        return value != null && SAFE_ID.matcher(value).matches();
    }

    public static boolean containsDangerousChars(String value) {
        return value != null && DANGEROUS_CONTROL.matcher(value).find();
    }

    public static boolean exceedsSizeLimit(String value, int maxBytes) {
        return value != null && value.getBytes(StandardCharsets.UTF_8).length > maxBytes;
    }
}
