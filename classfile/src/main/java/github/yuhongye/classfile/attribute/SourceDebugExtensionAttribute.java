package github.yuhongye.classfile.attribute;

import github.yuhongye.classfile.util.RawBytes;
import lombok.Getter;
import lombok.ToString;

/**
 * debug_extension 占满 attribute_length, 内容是 modified UTF-8 但不要求以此解码
 */
@Getter
@ToString(callSuper = true)
public class SourceDebugExtensionAttribute extends AttributeInfo {
    private final RawBytes debugExtension;

    public SourceDebugExtensionAttribute(int attributeNameIndex, long attributeLength, RawBytes debugExtension) {
        super(AttributeType.SOURCE_DEBUG_EXTENSION, attributeNameIndex, attributeLength);
        this.debugExtension = debugExtension;
    }
}
