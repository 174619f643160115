package github.yuhongye.classfile.parser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 解析时的严格程度, 默认全部开启
 */
@AllArgsConstructor
@Builder
@Getter
@ToString
public class ParserOptions {
    public static final ParserOptions DEFAULT = ParserOptions.builder().build();

    /**
     * 每个属性解析完后, 实际消费的字节数必须等于 attribute_length
     */
    @Builder.Default
    private final boolean checkAttributeLength = true;

    /**
     * 顶层属性之后不允许还有剩余字节
     */
    @Builder.Default
    private final boolean rejectTrailingBytes = true;
}
