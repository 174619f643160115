package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * sealed 类允许的直接子类
 */
@Getter
@ToString(callSuper = true)
public class PermittedSubclassesAttribute extends AttributeInfo {
    private final ImmutableList<Integer> classes;

    public PermittedSubclassesAttribute(int attributeNameIndex, long attributeLength, List<Integer> classes) {
        super(AttributeType.PERMITTED_SUBCLASSES, attributeNameIndex, attributeLength);
        this.classes = ImmutableList.copyOf(classes);
    }
}
