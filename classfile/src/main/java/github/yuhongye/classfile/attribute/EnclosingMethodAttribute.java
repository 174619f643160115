package github.yuhongye.classfile.attribute;

import lombok.Getter;
import lombok.ToString;

/**
 * 局部类和匿名类才有, methodIndex 为 0 表示不在任何方法内, 例如在字段初始化中
 */
@Getter
@ToString(callSuper = true)
public class EnclosingMethodAttribute extends AttributeInfo {
    private final int classIndex;
    private final int methodIndex;

    public EnclosingMethodAttribute(int attributeNameIndex, long attributeLength, int classIndex, int methodIndex) {
        super(AttributeType.ENCLOSING_METHOD, attributeNameIndex, attributeLength);
        this.classIndex = classIndex;
        this.methodIndex = methodIndex;
    }
}
