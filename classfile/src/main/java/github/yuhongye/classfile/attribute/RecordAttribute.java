package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Record_attribute {
 *     u2                    attribute_name_index;
 *     u4                    attribute_length;
 *     u2                    components_count;
 *     record_component_info components[components_count];
 * }
 */
@Getter
@ToString(callSuper = true)
public class RecordAttribute extends AttributeInfo {
    private final ImmutableList<RecordComponent> components;

    public RecordAttribute(int attributeNameIndex, long attributeLength, List<RecordComponent> components) {
        super(AttributeType.RECORD, attributeNameIndex, attributeLength);
        this.components = ImmutableList.copyOf(components);
    }

    /**
     * record_component_info {
     *     u2             name_index;
     *     u2             descriptor_index;
     *     u2             attributes_count;
     *     attribute_info attributes[attributes_count];
     * }
     */
    @Getter
    @ToString
    public static class RecordComponent {
        private final int nameIndex;
        private final int descriptorIndex;
        private final ImmutableList<AttributeInfo> attributes;

        public RecordComponent(int nameIndex, int descriptorIndex, List<AttributeInfo> attributes) {
            this.nameIndex = nameIndex;
            this.descriptorIndex = descriptorIndex;
            this.attributes = ImmutableList.copyOf(attributes);
        }

        public Optional<AttributeInfo> findAttribute(AttributeType type) {
            return AttributeInfo.find(attributes, type);
        }
    }
}
