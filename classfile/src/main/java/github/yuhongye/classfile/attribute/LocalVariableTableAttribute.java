package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * LocalVariableTable_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *     u2 local_variable_table_length;
 *     {   u2 start_pc;
 *         u2 length;
 *         u2 name_index;
 *         u2 descriptor_index;
 *         u2 index;
 *     } local_variable_table[local_variable_table_length];
 * }
 */
@Getter
@ToString(callSuper = true)
public class LocalVariableTableAttribute extends AttributeInfo {
    private final ImmutableList<LocalVariable> localVariableTable;

    public LocalVariableTableAttribute(int attributeNameIndex, long attributeLength,
                                       List<LocalVariable> localVariableTable) {
        super(AttributeType.LOCAL_VARIABLE_TABLE, attributeNameIndex, attributeLength);
        this.localVariableTable = ImmutableList.copyOf(localVariableTable);
    }

    /**
     * 变量在 [startPc, startPc + length) 内有效, 位于局部变量表第 index 个槽位
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static class LocalVariable {
        private final int startPc;
        private final int length;
        private final int nameIndex;
        private final int descriptorIndex;
        private final int index;
    }
}
