package github.yuhongye.classfile.attribute.stackmap;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * verification_type_info 的 tag
 */
@AllArgsConstructor
@Getter
public enum VerificationType {
    TOP(0),
    INTEGER(1),
    FLOAT(2),
    DOUBLE(3),
    LONG(4),
    NULL(5),
    UNINITIALIZED_THIS(6),
    /** 后面跟着 u2 cpool_index */
    OBJECT(7),
    /** 后面跟着 u2 offset, 指向创建该对象的 new 指令 */
    UNINITIALIZED(8),
    ;

    private int tag;

    public static VerificationType getByTag(int tag) {
        VerificationType[] values = values();
        return tag >= 0 && tag < values.length ? values[tag] : null;
    }

    public static List<Integer> allTags() {
        return Arrays.stream(values())
                .map(VerificationType::getTag)
                .collect(ImmutableList.toImmutableList());
    }
}
