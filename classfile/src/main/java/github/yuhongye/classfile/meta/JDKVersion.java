package github.yuhongye.classfile.meta;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * class 文件主版本号和 JDK 版本的对应关系
 */
@AllArgsConstructor
@Getter
public enum JDKVersion {
    JAVA_1_0_2(45, 3, "Java 1.0.2"),
    JAVA_1_1(45, 3, "Java 1.1"),
    JAVA_1_2(46, 0, "Java 1.2"),
    JAVA_1_3(47, 0, "Java 1.3"),
    JAVA_1_4(48, 0, "Java 1.4"),
    JAVA_5(  49, 0, "Java 5"),
    JAVA_6(  50, 0, "Java 6"),
    JAVA_7(  51, 0, "Java 7"),
    JAVA_8(  52, 0, "Java 8"),
    JAVA_9(  53, 0, "Java 9"),
    JAVA_10( 54, 0, "Java 10"),
    JAVA_11( 55, 0, "Java 11"),
    JAVA_12( 56, 0, "Java 12"),
    JAVA_13( 57, 0, "Java 13"),
    JAVA_14( 58, 0, "Java 14"),
    JAVA_15( 59, 0, "Java 15"),
    JAVA_16( 60, 0, "Java 16"),
    JAVA_17( 61, 0, "Java 17"),
    JAVA_18( 62, 0, "Java 18"),
    JAVA_19( 63, 0, "Java 19"),
    JAVA_20( 64, 0, "Java 20"),
    JAVA_21( 65, 0, "Java 21"),
    JAVA_22( 66, 0, "Java 22"),
    JAVA_23( 67, 0, "Java 23"),
    ;

    private int major;
    private int minor;
    private String jdkName;

    @Override
    public String toString() {
        return jdkName;
    }

    /**
     * 45 同时对应 1.0.2 和 1.1, 返回先出现的那个
     */
    public static Optional<JDKVersion> getByMajor(int major) {
        return Arrays.stream(values())
                .filter(o -> o.major == major)
                .findFirst();
    }
}
