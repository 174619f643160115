package github.yuhongye.classfile.attribute.annotation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor
@Getter
@ToString
public class ElementValuePair {
    private final int elementNameIndex;
    private final ElementValue value;
}
