package github.yuhongye.classfile.constant;

import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import lombok.Getter;

import java.util.List;

/**
 * 常量池, 提供按索引访问的能力: 从下标1开始, 0闲置不用.
 * 下标只在真正被用到时才检查, 越界, 指向占位项或者类型不对都会抛出 {@link MalformedClassFileException}
 */
public class ConstantPool {
    /**
     * 出错时用来标识是哪个文件
     */
    @Getter
    private final String subject;

    /**
     * index: 从1开始，0闲置不用; 长度等于 constant_pool_count
     */
    private final ImmutableList<ConstantInfo> entries;

    public ConstantPool(String subject, List<ConstantInfo> entries) {
        this.subject = subject;
        this.entries = ImmutableList.copyOf(entries);
    }

    /**
     * @return constant_pool_count, 包括下标 0 的占位项
     */
    public int size() {
        return entries.size();
    }

    public List<ConstantInfo> getEntries() {
        return entries;
    }

    /**
     * @param index
     * @param field 引用这个下标的字段名, 用于错误信息
     * @return 常量池的第 index 个常量
     */
    public ConstantInfo get(int index, String field) {
        if (index <= 0 || index >= entries.size()) {
            throw MalformedClassFileException.badReference(subject, field, index,
                    "index out of range [1, " + (entries.size() - 1) + "]");
        }
        ConstantInfo value = entries.get(index);
        if (value.isPlaceholder()) {
            throw MalformedClassFileException.badReference(subject, field, index,
                    "entry is unusable (second slot of a long or double)");
        }
        return value;
    }

    public <T extends ConstantInfo> T get(int index, Class<T> type, String field) {
        ConstantInfo value = get(index, field);
        if (!type.isInstance(value)) {
            throw MalformedClassFileException.badReference(subject, field, index,
                    "expected " + type.getSimpleName() + ", actual " + value.getTag());
        }
        return type.cast(value);
    }

    public String getUtf8(int index, String field) {
        return get(index, ConstantInfo.Utf8Info.class, field).getValue();
    }

    /**
     * Constant_Class_info -> Constant_Utf8_info
     */
    public String getClassName(int index, String field) {
        ConstantInfo.ClassInfo cls = get(index, ConstantInfo.ClassInfo.class, field);
        return getUtf8(cls.getNameIndex(), field + ".name_index");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Constant pool: \n");
        for (int i = 1; i < entries.size(); i++) {
            ConstantInfo value = entries.get(i);
            if (!value.isPlaceholder()) {
                const2String(value, i, sb);
            }
        }
        return sb.toString();
    }

    private void const2String(ConstantInfo value, int index, StringBuilder sb) {
        sb.append("#").append(index)
                .append(" = ")
                .append(value.getTag())
                .append("\t").append(value)
                .append("\n");
    }
}
