package github.yuhongye.classfile;

import github.yuhongye.classfile.attribute.AttributeInfo;
import github.yuhongye.classfile.attribute.AttributeType;
import github.yuhongye.classfile.attribute.CodeAttribute;
import github.yuhongye.classfile.meta.MethodAcc;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * 所有方法(包括实例初始化方法和类初始化方法)都是 method_info
 */
@ToString(callSuper = true)
public class MethodInfo extends MemberInfo {

    public MethodInfo(int accessFlags, int nameIndex, int descriptorIndex, List<AttributeInfo> attributes) {
        super(accessFlags, nameIndex, descriptorIndex, attributes);
    }

    @Override
    public String getAccessDescription() {
        return MethodAcc.toString(getAccessFlags());
    }

    /**
     * abstract 和 native 方法没有 Code 属性
     */
    public Optional<CodeAttribute> getCode() {
        return findAttribute(AttributeType.CODE).map(CodeAttribute.class::cast);
    }
}
