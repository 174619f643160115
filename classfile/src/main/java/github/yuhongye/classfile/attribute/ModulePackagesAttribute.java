package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 模块中所有的包, 每一项指向 Constant_Package_info
 */
@Getter
@ToString(callSuper = true)
public class ModulePackagesAttribute extends AttributeInfo {
    private final ImmutableList<Integer> packageIndex;

    public ModulePackagesAttribute(int attributeNameIndex, long attributeLength, List<Integer> packageIndex) {
        super(AttributeType.MODULE_PACKAGES, attributeNameIndex, attributeLength);
        this.packageIndex = ImmutableList.copyOf(packageIndex);
    }
}
