package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 字节码偏移量和源码行号的对应关系
 */
@Getter
@ToString(callSuper = true)
public class LineNumberTableAttribute extends AttributeInfo {
    private final ImmutableList<LineNumber> lineNumberTable;

    public LineNumberTableAttribute(int attributeNameIndex, long attributeLength, List<LineNumber> lineNumberTable) {
        super(AttributeType.LINE_NUMBER_TABLE, attributeNameIndex, attributeLength);
        this.lineNumberTable = ImmutableList.copyOf(lineNumberTable);
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static class LineNumber {
        private final int startPc;
        private final int lineNumber;
    }
}
