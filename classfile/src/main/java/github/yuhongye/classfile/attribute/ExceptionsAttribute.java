package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 方法 throws 声明的受检异常, 每一项指向 Constant_Class_info
 */
@Getter
@ToString(callSuper = true)
public class ExceptionsAttribute extends AttributeInfo {
    private final ImmutableList<Integer> exceptionIndexTable;

    public ExceptionsAttribute(int attributeNameIndex, long attributeLength, List<Integer> exceptionIndexTable) {
        super(AttributeType.EXCEPTIONS, attributeNameIndex, attributeLength);
        this.exceptionIndexTable = ImmutableList.copyOf(exceptionIndexTable);
    }
}
