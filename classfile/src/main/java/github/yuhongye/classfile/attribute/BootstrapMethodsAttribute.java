package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * BootstrapMethods_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *     u2 num_bootstrap_methods;
 *     {   u2 bootstrap_method_ref;
 *         u2 num_bootstrap_arguments;
 *         u2 bootstrap_arguments[num_bootstrap_arguments];
 *     } bootstrap_methods[num_bootstrap_methods];
 * }
 * Constant_Dynamic_info 和 Constant_InvokeDynamic_info 的 bootstrap_method_attr_index 是这里的下标
 */
@Getter
@ToString(callSuper = true)
public class BootstrapMethodsAttribute extends AttributeInfo {
    private final ImmutableList<BootstrapMethod> bootstrapMethods;

    public BootstrapMethodsAttribute(int attributeNameIndex, long attributeLength,
                                     List<BootstrapMethod> bootstrapMethods) {
        super(AttributeType.BOOTSTRAP_METHODS, attributeNameIndex, attributeLength);
        this.bootstrapMethods = ImmutableList.copyOf(bootstrapMethods);
    }

    @Getter
    @ToString
    public static class BootstrapMethod {
        /** 指向 Constant_MethodHandle_info */
        private final int bootstrapMethodRef;
        private final ImmutableList<Integer> bootstrapArguments;

        public BootstrapMethod(int bootstrapMethodRef, List<Integer> bootstrapArguments) {
            this.bootstrapMethodRef = bootstrapMethodRef;
            this.bootstrapArguments = ImmutableList.copyOf(bootstrapArguments);
        }
    }
}
