package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.meta.InnerClassAcc;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * InnerClasses_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *     u2 number_of_classes;
 *     {   u2 inner_class_info_index;
 *         u2 outer_class_info_index;
 *         u2 inner_name_index;
 *         u2 inner_class_access_flags;
 *     } classes[number_of_classes];
 * }
 */
@Getter
@ToString(callSuper = true)
public class InnerClassesAttribute extends AttributeInfo {
    private final ImmutableList<InnerClass> classes;

    public InnerClassesAttribute(int attributeNameIndex, long attributeLength, List<InnerClass> classes) {
        super(AttributeType.INNER_CLASSES, attributeNameIndex, attributeLength);
        this.classes = ImmutableList.copyOf(classes);
    }

    /**
     * outerClassInfoIndex 为 0 表示局部类或匿名类, innerNameIndex 为 0 表示匿名类
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static class InnerClass {
        private final int innerClassInfoIndex;
        private final int outerClassInfoIndex;
        private final int innerNameIndex;
        private final int innerClassAccessFlags;

        public String getAccessDescription() {
            return InnerClassAcc.toString(innerClassAccessFlags);
        }
    }
}
