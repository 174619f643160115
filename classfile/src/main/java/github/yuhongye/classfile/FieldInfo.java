package github.yuhongye.classfile;

import github.yuhongye.classfile.attribute.AttributeInfo;
import github.yuhongye.classfile.meta.FieldAcc;
import lombok.ToString;

import java.util.List;

@ToString(callSuper = true)
public class FieldInfo extends MemberInfo {

    public FieldInfo(int accessFlags, int nameIndex, int descriptorIndex, List<AttributeInfo> attributes) {
        super(accessFlags, nameIndex, descriptorIndex, attributes);
    }

    @Override
    public String getAccessDescription() {
        return FieldAcc.toString(getAccessFlags());
    }
}
