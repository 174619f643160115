package github.yuhongye.classfile.attribute;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.attribute.annotation.TypeAnnotation;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * RuntimeVisibleTypeAnnotations 和 RuntimeInvisibleTypeAnnotations
 */
@Getter
@ToString(callSuper = true)
public class TypeAnnotationsAttribute extends AttributeInfo {
    private final ImmutableList<TypeAnnotation> annotations;

    public TypeAnnotationsAttribute(AttributeType type, int attributeNameIndex, long attributeLength,
                                    List<TypeAnnotation> annotations) {
        super(type, attributeNameIndex, attributeLength);
        Preconditions.checkArgument(type == AttributeType.RUNTIME_VISIBLE_TYPE_ANNOTATIONS
                        || type == AttributeType.RUNTIME_INVISIBLE_TYPE_ANNOTATIONS,
                "%s is not a type annotations attribute", type);
        this.annotations = ImmutableList.copyOf(annotations);
    }

    public boolean isVisible() {
        return getType() == AttributeType.RUNTIME_VISIBLE_TYPE_ANNOTATIONS;
    }
}
