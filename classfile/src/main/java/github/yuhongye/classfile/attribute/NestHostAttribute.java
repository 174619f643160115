package github.yuhongye.classfile.attribute;

import lombok.Getter;
import lombok.ToString;

/**
 * 嵌套类指向它的宿主类
 */
@Getter
@ToString(callSuper = true)
public class NestHostAttribute extends AttributeInfo {
    private final int hostClassIndex;

    public NestHostAttribute(int attributeNameIndex, long attributeLength, int hostClassIndex) {
        super(AttributeType.NEST_HOST, attributeNameIndex, attributeLength);
        this.hostClassIndex = hostClassIndex;
    }
}
