package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 和 LocalVariableTable 结构一样, 只记录泛型变量, 第四项是签名而不是描述符
 */
@Getter
@ToString(callSuper = true)
public class LocalVariableTypeTableAttribute extends AttributeInfo {
    private final ImmutableList<LocalVariableType> localVariableTypeTable;

    public LocalVariableTypeTableAttribute(int attributeNameIndex, long attributeLength,
                                           List<LocalVariableType> localVariableTypeTable) {
        super(AttributeType.LOCAL_VARIABLE_TYPE_TABLE, attributeNameIndex, attributeLength);
        this.localVariableTypeTable = ImmutableList.copyOf(localVariableTypeTable);
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static class LocalVariableType {
        private final int startPc;
        private final int length;
        private final int nameIndex;
        private final int signatureIndex;
        private final int index;
    }
}
