package github.yuhongye.classfile.constant;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * CONSTANT_MethodHandle_info.reference_kind, 取值范围必须是 1-9:
 * 1, 2, 3, 4 是针对字段的, reference_index 指向 Constant_Fieldref_info;
 * 5, 6, 7, 8, 9 是针对方法调用的, 其中 8(REF_newInvokeSpecial) 指向的方法名称必须是 &lt;init&gt;
 */
@AllArgsConstructor
@Getter
public enum ReferenceKind {
    REF_GET_FIELD(1, "getField"),
    REF_GET_STATIC(2, "getStatic"),
    REF_PUT_FIELD(3, "putField"),
    REF_PUT_STATIC(4, "putStatic"),
    REF_INVOKE_VIRTUAL(5, "invokeVirtual"),
    REF_INVOKE_STATIC(6, "invokeStatic"),
    REF_INVOKE_SPECIAL(7, "invokeSpecial"),
    REF_NEW_INVOKE_SPECIAL(8, "newInvokeSpecial"),
    REF_INVOKE_INTERFACE(9, "invokeInterface"),
    ;

    private int kind;
    private String mnemonic;

    /**
     * @return kind 对应的枚举, 不在 1-9 之间返回 null
     */
    public static ReferenceKind getByKind(int kind) {
        ReferenceKind[] values = values();
        return kind >= 1 && kind <= values.length ? values[kind - 1] : null;
    }

    public static List<Integer> allKinds() {
        return Arrays.stream(values())
                .map(ReferenceKind::getKind)
                .collect(ImmutableList.toImmutableList());
    }
}
