package github.yuhongye.classfile.exceptions;

import lombok.Getter;

/**
 * modified UTF-8 编码错误, 带上出错的字节下标和相关字节
 */
@Getter
public class MalformedModifiedUtf8Exception extends ClassFormatException {
    private final int offset;

    public MalformedModifiedUtf8Exception(int offset, String message) {
        super("Malformed modified UTF-8 at byte " + offset + ": " + message);
        this.offset = offset;
    }

    public static MalformedModifiedUtf8Exception invalidLeadingByte(int offset, int b) {
        return new MalformedModifiedUtf8Exception(offset,
                "byte " + hex(b) + " can not start a character (0x00, 0x80-0xBF and 0xF0-0xFF are reserved)");
    }

    public static MalformedModifiedUtf8Exception truncated(int offset, int expected, int remaining, int... prefix) {
        StringBuilder sb = new StringBuilder("sequence starting with");
        for (int b : prefix) {
            sb.append(' ').append(hex(b));
        }
        sb.append(" expects ").append(expected).append(" more byte(s), but only ").append(remaining).append(" left");
        return new MalformedModifiedUtf8Exception(offset, sb.toString());
    }

    public static MalformedModifiedUtf8Exception badContinuation(int offset, int b) {
        return new MalformedModifiedUtf8Exception(offset, "byte " + hex(b) + " is not a continuation byte (10xxxxxx)");
    }

    public static MalformedModifiedUtf8Exception invalidCodepoint(int offset, int codepoint) {
        return new MalformedModifiedUtf8Exception(offset, "invalid codepoint " + hex(codepoint));
    }

    private static String hex(int value) {
        return "0x" + Integer.toHexString(value);
    }
}
