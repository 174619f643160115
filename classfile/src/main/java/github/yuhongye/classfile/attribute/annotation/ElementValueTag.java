package github.yuhongye.classfile.attribute.annotation;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * element_value 的 tag, 是一个 ASCII 字符
 */
@AllArgsConstructor
@Getter
public enum ElementValueTag {
    BYTE('B'),
    CHAR('C'),
    DOUBLE('D'),
    FLOAT('F'),
    INT('I'),
    LONG('J'),
    SHORT('S'),
    BOOLEAN('Z'),
    STRING('s'),
    ENUM('e'),
    CLASS('c'),
    ANNOTATION('@'),
    ARRAY('['),
    ;

    private char tag;

    private static final Map<Integer, ElementValueTag> tag2Enum = new HashMap<>();
    static {
        for (ElementValueTag tag : values()) {
            tag2Enum.put((int) tag.tag, tag);
        }
    }

    /**
     * B, C, D, F, I, J, S, Z, s 后面都只跟一个 const_value_index
     */
    public boolean isConstant() {
        return ordinal() <= STRING.ordinal();
    }

    public static ElementValueTag getByTag(int tag) {
        return tag2Enum.get(tag);
    }

    public static List<Integer> allTags() {
        return Arrays.stream(values())
                .map(t -> (int) t.tag)
                .collect(ImmutableList.toImmutableList());
    }
}
