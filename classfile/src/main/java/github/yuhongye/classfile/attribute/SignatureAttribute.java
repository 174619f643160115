package github.yuhongye.classfile.attribute;

import lombok.Getter;
import lombok.ToString;

/**
 * 泛型签名, signatureIndex 指向 Constant_Utf8_info
 */
@Getter
@ToString(callSuper = true)
public class SignatureAttribute extends AttributeInfo {
    private final int signatureIndex;

    public SignatureAttribute(int attributeNameIndex, long attributeLength, int signatureIndex) {
        super(AttributeType.SIGNATURE, attributeNameIndex, attributeLength);
        this.signatureIndex = signatureIndex;
    }
}
