package github.yuhongye.classfile.attribute.annotation;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * annotation {
 *     u2 type_index;  // 注解类型的字段描述符
 *     u2 num_element_value_pairs;
 *     {   u2            element_name_index;
 *         element_value value;
 *     } element_value_pairs[num_element_value_pairs];
 * }
 */
@Getter
@ToString
public class Annotation {
    private final int typeIndex;
    private final ImmutableList<ElementValuePair> elementValuePairs;

    public Annotation(int typeIndex, List<ElementValuePair> elementValuePairs) {
        this.typeIndex = typeIndex;
        this.elementValuePairs = ImmutableList.copyOf(elementValuePairs);
    }
}
