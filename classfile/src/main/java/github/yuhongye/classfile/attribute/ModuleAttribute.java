package github.yuhongye.classfile.attribute;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * module-info.class 才有:
 * Module_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *
 *     u2 module_name_index;
 *     u2 module_flags;
 *     u2 module_version_index;
 *
 *     u2 requires_count;
 *     {   u2 requires_index;
 *         u2 requires_flags;
 *         u2 requires_version_index;
 *     } requires[requires_count];
 *
 *     u2 exports_count;
 *     {   u2 exports_index;
 *         u2 exports_flags;
 *         u2 exports_to_count;
 *         u2 exports_to_index[exports_to_count];
 *     } exports[exports_count];
 *
 *     u2 opens_count;
 *     {   u2 opens_index;
 *         u2 opens_flags;
 *         u2 opens_to_count;
 *         u2 opens_to_index[opens_to_count];
 *     } opens[opens_count];
 *
 *     u2 uses_count;
 *     u2 uses_index[uses_count];
 *
 *     u2 provides_count;
 *     {   u2 provides_index;
 *         u2 provides_with_count;
 *         u2 provides_with_index[provides_with_count];
 *     } provides[provides_count];
 * }
 */
@Getter
@ToString(callSuper = true)
public class ModuleAttribute extends AttributeInfo {
    private final int moduleNameIndex;
    private final int moduleFlags;
    /** 0 表示没有版本信息 */
    private final int moduleVersionIndex;
    private final ImmutableList<Requires> requires;
    private final ImmutableList<Exports> exports;
    private final ImmutableList<Opens> opens;
    private final ImmutableList<Integer> usesIndex;
    private final ImmutableList<Provides> provides;

    public ModuleAttribute(int attributeNameIndex, long attributeLength,
                           int moduleNameIndex, int moduleFlags, int moduleVersionIndex,
                           List<Requires> requires, List<Exports> exports, List<Opens> opens,
                           List<Integer> usesIndex, List<Provides> provides) {
        super(AttributeType.MODULE, attributeNameIndex, attributeLength);
        this.moduleNameIndex = moduleNameIndex;
        this.moduleFlags = moduleFlags;
        this.moduleVersionIndex = moduleVersionIndex;
        this.requires = ImmutableList.copyOf(requires);
        this.exports = ImmutableList.copyOf(exports);
        this.opens = ImmutableList.copyOf(opens);
        this.usesIndex = ImmutableList.copyOf(usesIndex);
        this.provides = ImmutableList.copyOf(provides);
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static class Requires {
        /** 指向 Constant_Module_info */
        private final int requiresIndex;
        private final int requiresFlags;
        private final int requiresVersionIndex;
    }

    /**
     * exportsToIndex 为空表示导出给所有模块
     */
    @Getter
    @ToString
    public static class Exports {
        /** 指向 Constant_Package_info */
        private final int exportsIndex;
        private final int exportsFlags;
        private final ImmutableList<Integer> exportsToIndex;

        public Exports(int exportsIndex, int exportsFlags, List<Integer> exportsToIndex) {
            this.exportsIndex = exportsIndex;
            this.exportsFlags = exportsFlags;
            this.exportsToIndex = ImmutableList.copyOf(exportsToIndex);
        }
    }

    @Getter
    @ToString
    public static class Opens {
        private final int opensIndex;
        private final int opensFlags;
        private final ImmutableList<Integer> opensToIndex;

        public Opens(int opensIndex, int opensFlags, List<Integer> opensToIndex) {
            this.opensIndex = opensIndex;
            this.opensFlags = opensFlags;
            this.opensToIndex = ImmutableList.copyOf(opensToIndex);
        }
    }

    /**
     * providesIndex 是服务接口, providesWithIndex 是实现类, 都指向 Constant_Class_info
     */
    @Getter
    @ToString
    public static class Provides {
        private final int providesIndex;
        private final ImmutableList<Integer> providesWithIndex;

        public Provides(int providesIndex, List<Integer> providesWithIndex) {
            this.providesIndex = providesIndex;
            this.providesWithIndex = ImmutableList.copyOf(providesWithIndex);
        }
    }
}
