package com.phillippitts.bilingualtts.service.text;

/**
 * Character classes shared by the classifier and the splitters.
 */
final class TextCharacters {

    /** Full-width punctuation that belongs to a Chinese run. ASCII quotes are not included. */
    static final String CJK_PUNCTUATION = "｀，。！？；：“”‘’（）、";

    private TextCharacters() {
        throw new AssertionError("Utility class");
    }

    static boolean isCjkIdeograph(char c) {
        return c >= '一' && c <= '鿿';
    }

    static boolean isCjkPunctuation(char c) {
        return CJK_PUNCTUATION.indexOf(c) >= 0;
    }

    static boolean isCjk(char c) {
        return isCjkIdeograph(c) || isCjkPunctuation(c);
    }

    static boolean isLatinLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isNumericSymbol(char c) {
        return isAsciiDigit(c) || c == '.' || c == '%';
    }

    /**
     * True when {@code s} is non-empty, consists only of digits, {@code .} and {@code %},
     * and contains at least one digit. "42", "3.14" and "50%" are numeric; "." is not.
     */
    static boolean isNumeric(String s) {
        if (s == null || s.isEmpty()) {
            return false;
        }
        boolean digit = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!isNumericSymbol(c)) {
                return false;
            }
            digit |= isAsciiDigit(c);
        }
        return digit;
    }

    static boolean containsCjkIdeograph(CharSequence s, int from, int to) {
        for (int i = Math.max(0, from); i < Math.min(s.length(), to); i++) {
            if (isCjkIdeograph(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
