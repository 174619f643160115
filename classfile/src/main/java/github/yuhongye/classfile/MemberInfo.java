package github.yuhongye.classfile;

import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.attribute.AttributeInfo;
import github.yuhongye.classfile.attribute.AttributeType;
import github.yuhongye.classfile.constant.ConstantPool;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * 字段和方法的结构相同:
 * {
 *     u2 access_flags;
 *     u2 name_index;
 *     u2 descriptor_index;
 *     u2 attributes_count;
 *     attribute_info attributes[attributes_count];
 * }
 */
@Getter
@ToString
public abstract class MemberInfo {
    private final int accessFlags;
    private final int nameIndex;
    private final int descriptorIndex;
    private final ImmutableList<AttributeInfo> attributes;

    protected MemberInfo(int accessFlags, int nameIndex, int descriptorIndex, List<AttributeInfo> attributes) {
        this.accessFlags = accessFlags;
        this.nameIndex = nameIndex;
        this.descriptorIndex = descriptorIndex;
        this.attributes = ImmutableList.copyOf(attributes);
    }

    /**
     * @return 访问标志的可读形式, 例如 ACC_PUBLIC, ACC_STATIC
     */
    public abstract String getAccessDescription();

    public String getName(ConstantPool constantPool) {
        return constantPool.getUtf8(nameIndex, "name_index");
    }

    public String getDescriptor(ConstantPool constantPool) {
        return constantPool.getUtf8(descriptorIndex, "descriptor_index");
    }

    public Optional<AttributeInfo> findAttribute(AttributeType type) {
        return AttributeInfo.find(attributes, type);
    }
}
