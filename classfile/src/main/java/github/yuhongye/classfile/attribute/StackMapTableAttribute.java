package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.attribute.stackmap.StackMapFrame;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * StackMapTable_attribute {
 *     u2              attribute_name_index;
 *     u4              attribute_length;
 *     u2              number_of_entries;
 *     stack_map_frame entries[number_of_entries];
 * }
 */
@Getter
@ToString(callSuper = true)
public class StackMapTableAttribute extends AttributeInfo {
    private final ImmutableList<StackMapFrame> entries;

    public StackMapTableAttribute(int attributeNameIndex, long attributeLength, List<StackMapFrame> entries) {
        super(AttributeType.STACK_MAP_TABLE, attributeNameIndex, attributeLength);
        this.entries = ImmutableList.copyOf(entries);
    }
}
