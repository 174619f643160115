package github.yuhongye.classfile.attribute;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.attribute.annotation.Annotation;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * RuntimeVisibleParameterAnnotations 和 RuntimeInvisibleParameterAnnotations:
 * u1 num_parameters;
 * {   u2         num_annotations;
 *     annotation annotations[num_annotations];
 * } parameter_annotations[num_parameters];
 */
@Getter
@ToString(callSuper = true)
public class ParameterAnnotationsAttribute extends AttributeInfo {
    /**
     * 第 i 个元素是第 i 个参数上的注解
     */
    private final ImmutableList<ImmutableList<Annotation>> parameterAnnotations;

    public ParameterAnnotationsAttribute(AttributeType type, int attributeNameIndex, long attributeLength,
                                         List<? extends List<Annotation>> parameterAnnotations) {
        super(type, attributeNameIndex, attributeLength);
        Preconditions.checkArgument(type == AttributeType.RUNTIME_VISIBLE_PARAMETER_ANNOTATIONS
                        || type == AttributeType.RUNTIME_INVISIBLE_PARAMETER_ANNOTATIONS,
                "%s is not a parameter annotations attribute", type);
        this.parameterAnnotations = parameterAnnotations.stream()
                .map(ImmutableList::copyOf)
                .collect(ImmutableList.toImmutableList());
    }

    public boolean isVisible() {
        return getType() == AttributeType.RUNTIME_VISIBLE_PARAMETER_ANNOTATIONS;
    }
}
