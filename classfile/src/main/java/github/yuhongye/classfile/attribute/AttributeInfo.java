package github.yuhongye.classfile.attribute;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * attribute_info {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *     u1 info[attribute_length];
 * }
 */
@Getter
@ToString
public abstract class AttributeInfo {
    private final AttributeType type;
    private final int attributeNameIndex;
    private final long attributeLength;

    protected AttributeInfo(AttributeType type, int attributeNameIndex, long attributeLength) {
        this.type = type;
        this.attributeNameIndex = attributeNameIndex;
        this.attributeLength = attributeLength;
    }

    /**
     * @return 第一个类型为 type 的属性
     */
    public static Optional<AttributeInfo> find(List<AttributeInfo> attributes, AttributeType type) {
        return attributes.stream()
                .filter(attr -> attr.getType() == type)
                .findFirst();
    }
}
