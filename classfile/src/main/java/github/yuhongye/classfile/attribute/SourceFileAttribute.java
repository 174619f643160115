package github.yuhongye.classfile.attribute;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class SourceFileAttribute extends AttributeInfo {
    private final int sourceFileIndex;

    public SourceFileAttribute(int attributeNameIndex, long attributeLength, int sourceFileIndex) {
        super(AttributeType.SOURCE_FILE, attributeNameIndex, attributeLength);
        this.sourceFileIndex = sourceFileIndex;
    }
}
