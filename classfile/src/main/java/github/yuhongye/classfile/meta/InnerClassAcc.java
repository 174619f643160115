package github.yuhongye.classfile.meta;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * InnerClasses 属性中 inner_class_access_flags 的标志位
 */
@AllArgsConstructor
@Getter
public enum InnerClassAcc {
    ACC_PUBLIC(    0x0001, "源代码中声明为public"),
    ACC_PRIVATE(   0x0002, "源代码中声明为private"),
    ACC_PROTECTED( 0x0004, "源代码中声明为protected"),
    ACC_STATIC(    0x0008, "源代码中声明为static"),
    ACC_FINAL(     0x0010, "源代码中声明为final"),
    ACC_INTERFACE( 0x0200, "是接口"),
    ACC_ABSTRACT(  0x0400, "声明为abstract"),
    ACC_SYNTHETIC( 0x1000, "由编译器生成"),
    ACC_ANNOTATION(0x2000, "是注解类型"),
    ACC_ENUM(      0x4000, "是枚举类型")
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
