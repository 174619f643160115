package github.yuhongye.classfile.attribute;

import lombok.Getter;
import lombok.ToString;

/**
 * ConstantValue_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length; // 固定是2
 *     u2 constantvalue_index;
 * }
 * constantvalue_index 对应常量池的一个有效索引, 常量类型取决于字段类型:
 * long: Constant_Long_info, float: Constant_Float_info, double: Constant_Double_info,
 * int, short, char, byte, boolean: Constant_Integer_info, String: Constant_String_info
 */
@Getter
@ToString(callSuper = true)
public class ConstantValueAttribute extends AttributeInfo {
    private final int constantValueIndex;

    public ConstantValueAttribute(int attributeNameIndex, long attributeLength, int constantValueIndex) {
        super(AttributeType.CONSTANT_VALUE, attributeNameIndex, attributeLength);
        this.constantValueIndex = constantValueIndex;
    }
}
