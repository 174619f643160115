package github.yuhongye.classfile.attribute.annotation;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import lombok.Getter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * type_annotation.target_info 的结构, 由 target_type 决定
 */
public enum TargetKind {
    /** 泛型类, 接口或方法的类型参数声明 */
    TYPE_PARAMETER(0x00, 0x01),
    /** extends 或 implements 子句 */
    SUPERTYPE(0x10),
    /** 类型参数的边界 */
    TYPE_PARAMETER_BOUND(0x11, 0x12),
    /** 字段类型, 方法返回值类型, receiver 类型 */
    EMPTY(0x13, 0x14, 0x15),
    FORMAL_PARAMETER(0x16),
    THROWS(0x17),
    /** 局部变量和 try-with-resources 变量 */
    LOCALVAR(0x40, 0x41),
    CATCH(0x42),
    /** instanceof, new, 方法引用 */
    OFFSET(0x43, 0x44, 0x45, 0x46),
    /** 强制类型转换以及显式类型参数 */
    TYPE_ARGUMENT(0x47, 0x48, 0x49, 0x4A, 0x4B),
    ;

    @Getter
    private final List<Integer> targetTypes;

    TargetKind(int... targetTypes) {
        this.targetTypes = ImmutableList.copyOf(Ints.asList(targetTypes));
    }

    private static final Map<Integer, TargetKind> type2Enum = new HashMap<>();
    static {
        for (TargetKind kind : values()) {
            kind.targetTypes.forEach(t -> type2Enum.put(t, kind));
        }
    }

    public static TargetKind getByTargetType(int targetType) {
        return type2Enum.get(targetType);
    }

    public static List<Integer> allTargetTypes() {
        return Arrays.stream(values())
                .flatMap(kind -> kind.targetTypes.stream())
                .collect(ImmutableList.toImmutableList());
    }
}
