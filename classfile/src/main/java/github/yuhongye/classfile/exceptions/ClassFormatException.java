package github.yuhongye.classfile.exceptions;

/**
 * class 文件解析过程中所有格式错误的基类
 */
public class ClassFormatException extends RuntimeException {
    public ClassFormatException(String message) {
        super(message);
    }

    public ClassFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
