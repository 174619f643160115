package github.yuhongye.classfile.attribute;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.attribute.annotation.Annotation;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * RuntimeVisibleAnnotations 和 RuntimeInvisibleAnnotations, 两者结构相同:
 * u2 num_annotations;
 * annotation annotations[num_annotations];
 */
@Getter
@ToString(callSuper = true)
public class AnnotationsAttribute extends AttributeInfo {
    private final ImmutableList<Annotation> annotations;

    public AnnotationsAttribute(AttributeType type, int attributeNameIndex, long attributeLength,
                                List<Annotation> annotations) {
        super(type, attributeNameIndex, attributeLength);
        Preconditions.checkArgument(type == AttributeType.RUNTIME_VISIBLE_ANNOTATIONS
                || type == AttributeType.RUNTIME_INVISIBLE_ANNOTATIONS, "%s is not an annotations attribute", type);
        this.annotations = ImmutableList.copyOf(annotations);
    }

    /**
     * @return 运行时是否可以通过反射拿到
     */
    public boolean isVisible() {
        return getType() == AttributeType.RUNTIME_VISIBLE_ANNOTATIONS;
    }
}
