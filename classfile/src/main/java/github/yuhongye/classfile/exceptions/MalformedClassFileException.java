package github.yuhongye.classfile.exceptions;

import lombok.Getter;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * class 文件结构或字段取值不合法, 消息里总是带上文件标识和字段名, 数值统一用 16 进制输出
 */
@Getter
public class MalformedClassFileException extends ClassFormatException {
    private final String subject;
    private final String field;

    public MalformedClassFileException(String subject, String field, String detail) {
        super(format(subject, field, detail));
        this.subject = subject;
        this.field = field;
    }

    public MalformedClassFileException(String subject, String field, String detail, Throwable cause) {
        super(format(subject, field, detail), cause);
        this.subject = subject;
        this.field = field;
    }

    private static String format(String subject, String field, String detail) {
        return "Malformed class file " + subject + ": " + field + " " + detail;
    }

    public static String hex(long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * 字段的值和期望的固定值不一致, 例如 magic
     */
    public static MalformedClassFileException wrongValue(String subject, String field, long actual, long expected) {
        return new MalformedClassFileException(subject, field,
                "has wrong value, expected: " + hex(expected) + ", actual: " + hex(actual));
    }

    /**
     * 字段的值不在允许的集合中, 例如未知的常量池 tag
     */
    public static MalformedClassFileException notOneOf(String subject, String field, long actual,
                                                       Collection<? extends Number> allowed) {
        String expected = allowed.stream()
                .map(v -> hex(v.longValue()))
                .collect(Collectors.joining(", ", "[", "]"));
        return new MalformedClassFileException(subject, field,
                "has wrong value, expected one of: " + expected + ", actual: " + hex(actual));
    }

    public static MalformedClassFileException unknownName(String subject, String field, String name) {
        return new MalformedClassFileException(subject, field, "has unknown name: \"" + name + "\"");
    }

    /**
     * 常量池下标越界, 指向占位项, 或者指向的常量类型不对
     */
    public static MalformedClassFileException badReference(String subject, String field, int index, String reason) {
        return new MalformedClassFileException(subject, field, "refers to constant pool #" + index + ": " + reason);
    }
}
