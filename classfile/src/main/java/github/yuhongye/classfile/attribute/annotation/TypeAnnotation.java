package github.yuhongye.classfile.attribute.annotation;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * type_annotation {
 *     u1 target_type;
 *     union { ... } target_info;
 *     type_path target_path;
 *     u2        type_index;
 *     u2        num_element_value_pairs;
 *     {   u2            element_name_index;
 *         element_value value;
 *     } element_value_pairs[num_element_value_pairs];
 * }
 */
@Getter
@ToString
public class TypeAnnotation {
    private final int targetType;
    private final TargetInfo targetInfo;
    private final ImmutableList<TypePathEntry> targetPath;
    private final int typeIndex;
    private final ImmutableList<ElementValuePair> elementValuePairs;

    public TypeAnnotation(int targetType, TargetInfo targetInfo, List<TypePathEntry> targetPath,
                          int typeIndex, List<ElementValuePair> elementValuePairs) {
        this.targetType = targetType;
        this.targetInfo = targetInfo;
        this.targetPath = ImmutableList.copyOf(targetPath);
        this.typeIndex = typeIndex;
        this.elementValuePairs = ImmutableList.copyOf(elementValuePairs);
    }
}
