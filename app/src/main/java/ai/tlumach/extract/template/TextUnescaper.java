package ai.tlumach.extract.template;

/**
 * Decodes backslash escapes as used in JSON and TOML basic strings.
 * Unknown or incomplete sequences are kept as they are.
 */
public final class TextUnescaper {

    private TextUnescaper() {
    }

    public static String unescape(String value) {
        if (value == null || value.indexOf('\\') == -1) {
            return value;
        }
        StringBuilder builder = new StringBuilder(value.length());
        int length = value.length();
        int i = 0;
        while (i < length) {
            char ch = value.charAt(i);
            if (ch != '\\') {
                builder.append(ch);
                i++;
                continue;
            }
            i++;
            if (i >= length) {
                // a lone trailing backslash is dropped
                break;
            }
            char next = value.charAt(i);
            switch (next) {
                case '"' -> builder.append('"');
                case '\\' -> builder.append('\\');
                case '/' -> builder.append('/');
                case 'b' -> builder.append('\b');
                case 'f' -> builder.append('\f');
                case 'n' -> builder.append('\n');
                case 'r' -> builder.append('\r');
                case 't' -> builder.append('\t');
                case 'u' -> i = appendUnicode(value, i, builder);
                default -> builder.append('\\').append(next);
            }
            i++;
        }
        return builder.toString();
    }

    /**
     * Appends the character of a four-digit unicode sequence whose {@code u} is at {@code index}.
     *
     * @return the index of the last consumed character
     */
    private static int appendUnicode(String value, int index, StringBuilder builder) {
        if (index + 4 >= value.length()) {
            builder.append("\\u");
            return index;
        }
        int code = 0;
        for (int i = index + 1; i <= index + 4; i++) {
            char c = value.charAt(i);
            int digit = c < 0x80 ? Character.digit(c, 16) : -1;
            if (digit < 0) {
                builder.append("\\u");
                return index;
            }
            code = code * 16 + digit;
        }
        builder.append((char) code);
        return index + 4;
    }
}
