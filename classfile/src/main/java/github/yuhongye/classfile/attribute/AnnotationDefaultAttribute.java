package github.yuhongye.classfile.attribute;

import github.yuhongye.classfile.attribute.annotation.ElementValue;
import lombok.Getter;
import lombok.ToString;

/**
 * 注解接口中方法的默认值
 */
@Getter
@ToString(callSuper = true)
public class AnnotationDefaultAttribute extends AttributeInfo {
    private final ElementValue defaultValue;

    public AnnotationDefaultAttribute(int attributeNameIndex, long attributeLength, ElementValue defaultValue) {
        super(AttributeType.ANNOTATION_DEFAULT, attributeNameIndex, attributeLength);
        this.defaultValue = defaultValue;
    }
}
