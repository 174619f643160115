package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 宿主类列出的所有嵌套成员
 */
@Getter
@ToString(callSuper = true)
public class NestMembersAttribute extends AttributeInfo {
    private final ImmutableList<Integer> classes;

    public NestMembersAttribute(int attributeNameIndex, long attributeLength, List<Integer> classes) {
        super(AttributeType.NEST_MEMBERS, attributeNameIndex, attributeLength);
        this.classes = ImmutableList.copyOf(classes);
    }
}
