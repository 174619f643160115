package github.yuhongye.classfile.attribute;

import com.google.common.base.Preconditions;
import lombok.ToString;

/**
 * Synthetic 和 Deprecated, 只有名字没有内容
 */
@ToString(callSuper = true)
public class MarkerAttribute extends AttributeInfo {

    public MarkerAttribute(AttributeType type, int attributeNameIndex, long attributeLength) {
        super(type, attributeNameIndex, attributeLength);
        Preconditions.checkArgument(type == AttributeType.SYNTHETIC || type == AttributeType.DEPRECATED,
                "%s is not a marker attribute", type);
    }
}
