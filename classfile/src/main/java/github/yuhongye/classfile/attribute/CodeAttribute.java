package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.util.RawBytes;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Code_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *     u2 max_stack;
 *     u2 max_locals;
 *     u4 code_length;
 *     u1 code[code_length];
 *     u2 exception_table_length;
 *     {   u2 start_pc;
 *         u2 end_pc;
 *         u2 handler_pc;
 *         u2 catch_type;
 *     } exception_table[exception_table_length];
 *     u2 attributes_count;
 *     attribute_info attributes[attributes_count];
 * }
 */
@Getter
@ToString(callSuper = true)
public class CodeAttribute extends AttributeInfo {
    /** 操作数栈的最大深度 */
    private final int maxStack;
    /** 局部变量表需要的槽位数, long 和 double 占两个 */
    private final int maxLocals;
    private final RawBytes code;
    private final ImmutableList<ExceptionTableEntry> exceptionTable;
    private final ImmutableList<AttributeInfo> attributes;

    public CodeAttribute(int attributeNameIndex, long attributeLength, int maxStack, int maxLocals, RawBytes code,
                         List<ExceptionTableEntry> exceptionTable, List<AttributeInfo> attributes) {
        super(AttributeType.CODE, attributeNameIndex, attributeLength);
        this.maxStack = maxStack;
        this.maxLocals = maxLocals;
        this.code = code;
        this.exceptionTable = ImmutableList.copyOf(exceptionTable);
        this.attributes = ImmutableList.copyOf(attributes);
    }

    public Optional<AttributeInfo> findAttribute(AttributeType type) {
        return AttributeInfo.find(attributes, type);
    }

    /**
     * [startPc, endPc) 区间内抛出 catchType 类型的异常时跳到 handlerPc;
     * catchType 为 0 表示捕获所有异常, 用于 finally
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static class ExceptionTableEntry {
        private final int startPc;
        private final int endPc;
        private final int handlerPc;
        private final int catchType;
    }
}
