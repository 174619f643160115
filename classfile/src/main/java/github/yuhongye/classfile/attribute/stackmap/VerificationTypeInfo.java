package github.yuhongye.classfile.attribute.stackmap;

import com.google.common.base.Preconditions;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.EnumMap;
import java.util.Map;

/**
 * 栈帧中局部变量表或者操作数栈一个槽位的类型
 */
public abstract class VerificationTypeInfo {

    VerificationTypeInfo() { }

    public abstract VerificationType getType();

    private static final Map<VerificationType, Simple> SIMPLE_TYPES = new EnumMap<>(VerificationType.class);
    static {
        for (VerificationType type : VerificationType.values()) {
            if (type != VerificationType.OBJECT && type != VerificationType.UNINITIALIZED) {
                SIMPLE_TYPES.put(type, new Simple(type));
            }
        }
    }

    /**
     * Top, Integer, Float, Double, Long, Null, UninitializedThis 除了 tag 之外没有别的内容
     */
    public static Simple of(VerificationType type) {
        Simple simple = SIMPLE_TYPES.get(type);
        Preconditions.checkArgument(simple != null, "%s carries a payload", type);
        return simple;
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class Simple extends VerificationTypeInfo {
        private final VerificationType type;
    }

    /**
     * cpoolIndex 指向 Constant_Class_info
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class ObjectVariable extends VerificationTypeInfo {
        private final int cpoolIndex;

        @Override
        public VerificationType getType() {
            return VerificationType.OBJECT;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class UninitializedVariable extends VerificationTypeInfo {
        private final int offset;

        @Override
        public VerificationType getType() {
            return VerificationType.UNINITIALIZED;
        }
    }
}
