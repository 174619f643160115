package github.yuhongye.classfile.constant;

import github.yuhongye.classfile.util.BigEndian;
import github.yuhongye.classfile.util.RawBytes;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 常量池中的一项, 通过 {@link #getTag()} 区分具体类型.
 * 各个字段保存的都是原始值或者常量池下标, 下标只有在用到的时候才去解析
 */
public abstract class ConstantInfo {
    /**
     * 下标 0 以及 long/double 之后的那个下标都不能使用, 用它来占位
     */
    public static final ConstantInfo PLACEHOLDER = new Placeholder();

    ConstantInfo() { }

    /**
     * @return 常量类型, 占位项返回 null
     */
    public abstract ConstantTag getTag();

    public boolean isPlaceholder() {
        return false;
    }

    private static final class Placeholder extends ConstantInfo {
        @Override
        public ConstantTag getTag() {
            return null;
        }

        @Override
        public boolean isPlaceholder() {
            return true;
        }

        @Override
        public String toString() {
            return "(unusable)";
        }
    }

    /**
     * 原始的 modified UTF-8 字节和解码后的字符串
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class Utf8Info extends ConstantInfo {
        @ToString.Exclude
        private final RawBytes bytes;
        private final String value;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_UTF8_INFO;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class IntegerInfo extends ConstantInfo {
        private final RawBytes bytes;

        public int intValue() {
            return BigEndian.readInt(bytes);
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_INTEGER_INFO;
        }
    }

    /**
     * bytes 是 IEEE 754 单精度浮点数
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class FloatInfo extends ConstantInfo {
        private final RawBytes bytes;

        public float floatValue() {
            return Float.intBitsToFloat(BigEndian.readInt(bytes));
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_FLOAT_INFO;
        }
    }

    /**
     * 占用两个常量池下标
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class LongInfo extends ConstantInfo {
        private final long highBytes;
        private final long lowBytes;

        public long longValue() {
            return BigEndian.combine(highBytes, lowBytes);
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_LONG_INFO;
        }
    }

    /**
     * 占用两个常量池下标
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class DoubleInfo extends ConstantInfo {
        private final long highBytes;
        private final long lowBytes;

        public double doubleValue() {
            return Double.longBitsToDouble(BigEndian.combine(highBytes, lowBytes));
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_DOUBLE_INFO;
        }
    }

    /**
     * 类或者接口, nameIndex 指向类的二进制名称(Constant_Utf8_info)
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class ClassInfo extends ConstantInfo {
        private final int nameIndex;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_CLASS_INFO;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class StringInfo extends ConstantInfo {
        private final int stringIndex;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_STRING_INFO;
        }
    }

    /**
     * FieldRef_Info, MethodRef_Info, InterfaceMethodRef_info 的公共结构
     */
    @Getter
    @ToString
    public abstract static class MemberRefInfo extends ConstantInfo {
        /** 所属的类信息在常量池中的下标 */
        private final int classIndex;

        /** 指向一个 {@link NameAndTypeInfo} 的下标 表示名称和描述符 */
        private final int nameAndTypeIndex;

        MemberRefInfo(int classIndex, int nameAndTypeIndex) {
            this.classIndex = classIndex;
            this.nameAndTypeIndex = nameAndTypeIndex;
        }
    }

    @ToString(callSuper = true)
    public static final class FieldRefInfo extends MemberRefInfo {
        public FieldRefInfo(int classIndex, int nameAndTypeIndex) {
            super(classIndex, nameAndTypeIndex);
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_FIELDREF_INFO;
        }
    }

    @ToString(callSuper = true)
    public static final class MethodRefInfo extends MemberRefInfo {
        public MethodRefInfo(int classIndex, int nameAndTypeIndex) {
            super(classIndex, nameAndTypeIndex);
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_METHODREF_INFO;
        }
    }

    @ToString(callSuper = true)
    public static final class InterfaceMethodRefInfo extends MemberRefInfo {
        public InterfaceMethodRefInfo(int classIndex, int nameAndTypeIndex) {
            super(classIndex, nameAndTypeIndex);
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_INTERFACEMETHODREF_INFO;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class NameAndTypeInfo extends ConstantInfo {
        // 字段或者方法名称在常量池的下标
        private final int nameIndex;

        // 字段或方法的描述在常量池的下标
        private final int descriptorIndex;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_NAMEANDTYPE_INFO;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class MethodHandleInfo extends ConstantInfo {
        private final ReferenceKind referenceKind;

        /**
         * 根据 {@link #referenceKind} 指向 Fieldref, Methodref 或者 InterfaceMethodref
         */
        private final int referenceIndex;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_METHODHANDLE_INFO;
        }
    }

    /**
     * 方法的描述符
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class MethodTypeInfo extends ConstantInfo {
        private final int descriptorIndex;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_METHODTYPE_INFO;
        }
    }

    /**
     * CONSTANT_Dynamic_info 和 CONSTANT_InvokeDynamic_info 的公共结构
     */
    @Getter
    @ToString
    public abstract static class BootstrapRefInfo extends ConstantInfo {
        /**
         * BootstrapMethods 属性中 bootstrap_methods[] 数组的下标
         */
        private final int bootstrapMethodAttrIndex;

        /**
         * 指向{@link NameAndTypeInfo}的索引
         */
        private final int nameAndTypeIndex;

        BootstrapRefInfo(int bootstrapMethodAttrIndex, int nameAndTypeIndex) {
            this.bootstrapMethodAttrIndex = bootstrapMethodAttrIndex;
            this.nameAndTypeIndex = nameAndTypeIndex;
        }
    }

    /**
     * 动态计算的常量(Java 11)
     */
    @ToString(callSuper = true)
    public static final class DynamicInfo extends BootstrapRefInfo {
        public DynamicInfo(int bootstrapMethodAttrIndex, int nameAndTypeIndex) {
            super(bootstrapMethodAttrIndex, nameAndTypeIndex);
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_DYNAMIC_INFO;
        }
    }

    /**
     * invokedynamic 指令的调用点
     */
    @ToString(callSuper = true)
    public static final class InvokeDynamicInfo extends BootstrapRefInfo {
        public InvokeDynamicInfo(int bootstrapMethodAttrIndex, int nameAndTypeIndex) {
            super(bootstrapMethodAttrIndex, nameAndTypeIndex);
        }

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_INVOKEDYNAMIC_INFO;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class ModuleInfo extends ConstantInfo {
        private final int nameIndex;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_MODULE_INFO;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class PackageInfo extends ConstantInfo {
        private final int nameIndex;

        @Override
        public ConstantTag getTag() {
            return ConstantTag.CONSTANT_PACKAGE_INFO;
        }
    }
}
