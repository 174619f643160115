package github.yuhongye.classfile;

import com.google.common.collect.ImmutableList;
import github.yuhongye.classfile.attribute.AttributeInfo;
import github.yuhongye.classfile.attribute.AttributeType;
import github.yuhongye.classfile.constant.ConstantPool;
import github.yuhongye.classfile.meta.ClassAcc;
import github.yuhongye.classfile.meta.JDKVersion;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Java class 文件结构
 * class file {
 *     u4 magic;
 *
 *     u2 minor_version;
 *     u2 major_version;
 *
 *     u2 constant_pool_count;
 *     cp_info constant_pool[constant_pool_count - 1]; // 索引从1-constant_pool_count-1, 0 属性保留索引
 *
 *     u2 access_flags;
 *
 *     u2 this_class;
 *     u2 super_class;
 *     u2 interface_count;
 *     u2 interfaces[interface_count];
 *
 *     u2 fields_count;
 *     field_info fields[fields_count];
 *
 *     u2 methods_count;
 *     method_info methods[methods_count];
 *
 *     u2 attributes_count;
 *     attribute_info attributes[attributes_count];
 * }
 */
@Getter
@ToString
public class ClassFile {
    private final long magic;
    private final int minorVersion;
    private final int majorVersion;
    private final ConstantPool constantPool;
    private final int accessFlags;
    private final int thisClass;
    /** 只有 java.lang.Object 和 module-info 为 0 */
    private final int superClass;
    private final ImmutableList<Integer> interfaces;
    private final ImmutableList<FieldInfo> fields;
    private final ImmutableList<MethodInfo> methods;
    private final ImmutableList<AttributeInfo> attributes;

    @Builder
    public ClassFile(long magic, int minorVersion, int majorVersion, ConstantPool constantPool, int accessFlags,
                     int thisClass, int superClass, List<Integer> interfaces, List<FieldInfo> fields,
                     List<MethodInfo> methods, List<AttributeInfo> attributes) {
        this.magic = magic;
        this.minorVersion = minorVersion;
        this.majorVersion = majorVersion;
        this.constantPool = constantPool;
        this.accessFlags = accessFlags;
        this.thisClass = thisClass;
        this.superClass = superClass;
        this.interfaces = ImmutableList.copyOf(interfaces);
        this.fields = ImmutableList.copyOf(fields);
        this.methods = ImmutableList.copyOf(methods);
        this.attributes = ImmutableList.copyOf(attributes);
    }

    public int getConstantPoolCount() {
        return constantPool.size();
    }

    public String getAccessDescription() {
        return ClassAcc.toString(accessFlags);
    }

    /**
     * @return 编译该文件的 jdk 版本, 不认识的主版本号返回 empty
     */
    public Optional<JDKVersion> getJdkVersion() {
        return JDKVersion.getByMajor(majorVersion);
    }

    public String getThisClassName() {
        return constantPool.getClassName(thisClass, "this_class");
    }

    /**
     * @return 父类的内部名字, super_class 为 0 时返回 null
     */
    public String getSuperClassName() {
        return superClass == 0 ? null : constantPool.getClassName(superClass, "super_class");
    }

    public List<String> getInterfaceNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (int i = 0; i < interfaces.size(); i++) {
            names.add(constantPool.getClassName(interfaces.get(i), "interfaces[" + i + "]"));
        }
        return names.build();
    }

    public Optional<AttributeInfo> findAttribute(AttributeType type) {
        return AttributeInfo.find(attributes, type);
    }
}
