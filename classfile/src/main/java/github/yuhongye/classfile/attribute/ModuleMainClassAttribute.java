package github.yuhongye.classfile.attribute;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class ModuleMainClassAttribute extends AttributeInfo {
    private final int mainClassIndex;

    public ModuleMainClassAttribute(int attributeNameIndex, long attributeLength, int mainClassIndex) {
        super(AttributeType.MODULE_MAIN_CLASS, attributeNameIndex, attributeLength);
        this.mainClassIndex = mainClassIndex;
    }
}
