package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 形参的名字和修饰符, javac -parameters 时生成; parameters_count 是 u1
 */
@Getter
@ToString(callSuper = true)
public class MethodParametersAttribute extends AttributeInfo {
    private final ImmutableList<Parameter> parameters;

    public MethodParametersAttribute(int attributeNameIndex, long attributeLength, List<Parameter> parameters) {
        super(AttributeType.METHOD_PARAMETERS, attributeNameIndex, attributeLength);
        this.parameters = ImmutableList.copyOf(parameters);
    }

    /**
     * nameIndex 为 0 表示没有名字; accessFlags 只可能是 ACC_FINAL, ACC_SYNTHETIC, ACC_MANDATED
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static class Parameter {
        private final int nameIndex;
        private final int accessFlags;
    }
}
