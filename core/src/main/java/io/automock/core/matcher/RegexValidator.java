package io.automock.core.matcher;

import io.automock.core.error.RegexValidationException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Compiles operator-supplied patterns before they are accepted into an expectation. */
public final class RegexValidator {

    private RegexValidator() {}

    /**
     * Compiles {@code pattern}.
     *
     * @param pattern the regular expression
     * @param context where it is used: "request body", "path matching",
     *                "header matching", ...
     * @return the compiled pattern
     * @throws RegexValidationException naming the pattern and context if it does
     *                                  not compile
     */
    public static Pattern validate(String pattern, String context) {
        if (pattern == null) {
            throw new RegexValidationException("null", context, null);
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new RegexValidationException(pattern, context, e);
        }
    }

    /** True if {@code pattern} compiles. */
    public static boolean isValid(String pattern) {
        if (pattern == null) {
            return false;
        }
        try {
            Pattern.compile(pattern);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }
}
