package github.yuhongye.classfile.attribute.annotation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * type_path 中的一步:
 * kind 0 进入数组元素类型, 1 进入嵌套类型, 2 进入通配符边界, 3 进入第 typeArgumentIndex 个类型参数
 */
@AllArgsConstructor
@Getter
@ToString
public class TypePathEntry {
    private final int typePathKind;
    private final int typeArgumentIndex;
}
