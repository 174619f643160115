package github.yuhongye.classfile.attribute.annotation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * element_value {
 *     u1 tag;
 *     union {
 *         u2 const_value_index;
 *         { u2 type_name_index; u2 const_name_index; } enum_const_value;
 *         u2 class_info_index;
 *         annotation annotation_value;
 *         { u2 num_values; element_value values[num_values]; } array_value;
 *     } value;
 * }
 */
@Getter
@ToString
public abstract class ElementValue {
    private final ElementValueTag tag;

    ElementValue(ElementValueTag tag) {
        this.tag = tag;
    }

    /**
     * 基本类型和 String, constValueIndex 指向对应类型的常量
     */
    @Getter
    @ToString(callSuper = true)
    public static final class ConstValue extends ElementValue {
        private final int constValueIndex;

        public ConstValue(ElementValueTag tag, int constValueIndex) {
            super(tag);
            Preconditions.checkArgument(tag.isConstant(), "%s is not a constant tag", tag);
            this.constValueIndex = constValueIndex;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static final class EnumConstValue extends ElementValue {
        /** 枚举类型的描述符 */
        private final int typeNameIndex;
        /** 枚举常量的简单名称 */
        private final int constNameIndex;

        public EnumConstValue(int typeNameIndex, int constNameIndex) {
            super(ElementValueTag.ENUM);
            this.typeNameIndex = typeNameIndex;
            this.constNameIndex = constNameIndex;
        }
    }

    /**
     * classInfoIndex 指向返回值描述符, 例如 Ljava/lang/Object; 或者 V
     */
    @Getter
    @ToString(callSuper = true)
    public static final class ClassValue extends ElementValue {
        private final int classInfoIndex;

        public ClassValue(int classInfoIndex) {
            super(ElementValueTag.CLASS);
            this.classInfoIndex = classInfoIndex;
        }
    }

    /**
     * 嵌套的注解
     */
    @Getter
    @ToString(callSuper = true)
    public static final class AnnotationValue extends ElementValue {
        private final Annotation annotation;

        public AnnotationValue(Annotation annotation) {
            super(ElementValueTag.ANNOTATION);
            this.annotation = annotation;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static final class ArrayValue extends ElementValue {
        private final ImmutableList<ElementValue> values;

        public ArrayValue(List<ElementValue> values) {
            super(ElementValueTag.ARRAY);
            this.values = ImmutableList.copyOf(values);
        }
    }
}
