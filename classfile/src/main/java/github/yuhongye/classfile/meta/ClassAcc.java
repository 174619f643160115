package github.yuhongye.classfile.meta;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ClassFile.access_flags 的标志位, 只用于展示, 不做校验
 */
@AllArgsConstructor
@Getter
public enum ClassAcc {
    ACC_PUBLIC(    0x0001, "声明为public, 可以包外访问"),
    ACC_FINAL(     0x0010, "声明为final, 不允许有子类"),
    ACC_SUPER(     0x0020, "invokespecial使用新语义(JDK 1.0.2之后的编译器都会设置)"),
    ACC_INTERFACE( 0x0200, "该类文件定义的是接口而不是类"),
    ACC_ABSTRACT(  0x0400, "声明为abstract，不能被实例化"),
    ACC_SYNTHETIC( 0x1000, "表明该class文件并非由Java源代码生成"),
    ACC_ANNOTATION(0x2000, "标识注解类型"),
    ACC_ENUM(      0x4000, "标识枚举类型"),
    ACC_MODULE(    0x8000, "该class文件描述的是模块, 而不是类或接口")
    ;

    private int mask;
    private String desc;

    public boolean is(int accessFlag) {
        return (mask & accessFlag) != 0;
    }

    public static String toString(int accessFlag) {
        return Arrays.stream(values())
                .filter(acc -> acc.is(accessFlag))
                .map(Objects::toString)
                .collect(Collectors.joining(", "));
    }
}
