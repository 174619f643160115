package github.yuhongye.classfile.attribute;

import github.yuhongye.classfile.meta.JDKVersion;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * 预定义的属性, 通过 attribute_name_index 指向的名字区分
 */
@AllArgsConstructor
@Getter
public enum AttributeType {
    CONSTANT_VALUE                         ("ConstantValue",                        JDKVersion.JAVA_1_0_2, 2),
    CODE                                   ("Code",                                 JDKVersion.JAVA_1_0_2),
    STACK_MAP_TABLE                        ("StackMapTable",                        JDKVersion.JAVA_6),
    EXCEPTIONS                             ("Exceptions",                           JDKVersion.JAVA_1_0_2),
    INNER_CLASSES                          ("InnerClasses",                         JDKVersion.JAVA_1_1),
    ENCLOSING_METHOD                       ("EnclosingMethod",                      JDKVersion.JAVA_5, 4),
    SYNTHETIC                              ("Synthetic",                            JDKVersion.JAVA_1_1, 0),
    SIGNATURE                              ("Signature",                            JDKVersion.JAVA_5, 2),
    SOURCE_FILE                            ("SourceFile",                           JDKVersion.JAVA_1_0_2, 2),
    SOURCE_DEBUG_EXTENSION                 ("SourceDebugExtension",                 JDKVersion.JAVA_5),
    LINE_NUMBER_TABLE                      ("LineNumberTable",                      JDKVersion.JAVA_1_0_2),
    LOCAL_VARIABLE_TABLE                   ("LocalVariableTable",                   JDKVersion.JAVA_1_0_2),
    LOCAL_VARIABLE_TYPE_TABLE              ("LocalVariableTypeTable",               JDKVersion.JAVA_5),
    DEPRECATED                             ("Deprecated",                           JDKVersion.JAVA_1_1, 0),
    RUNTIME_VISIBLE_ANNOTATIONS            ("RuntimeVisibleAnnotations",            JDKVersion.JAVA_5),
    RUNTIME_INVISIBLE_ANNOTATIONS          ("RuntimeInvisibleAnnotations",          JDKVersion.JAVA_5),
    RUNTIME_VISIBLE_PARAMETER_ANNOTATIONS  ("RuntimeVisibleParameterAnnotations",   JDKVersion.JAVA_5),
    RUNTIME_INVISIBLE_PARAMETER_ANNOTATIONS("RuntimeInvisibleParameterAnnotations", JDKVersion.JAVA_5),
    RUNTIME_VISIBLE_TYPE_ANNOTATIONS       ("RuntimeVisibleTypeAnnotations",        JDKVersion.JAVA_8),
    RUNTIME_INVISIBLE_TYPE_ANNOTATIONS     ("RuntimeInvisibleTypeAnnotations",      JDKVersion.JAVA_8),
    ANNOTATION_DEFAULT                     ("AnnotationDefault",                    JDKVersion.JAVA_5),
    BOOTSTRAP_METHODS                      ("BootstrapMethods",                     JDKVersion.JAVA_7),
    METHOD_PARAMETERS                      ("MethodParameters",                     JDKVersion.JAVA_8),
    MODULE                                 ("Module",                               JDKVersion.JAVA_9),
    MODULE_PACKAGES                        ("ModulePackages",                       JDKVersion.JAVA_9),
    MODULE_MAIN_CLASS                      ("ModuleMainClass",                      JDKVersion.JAVA_9, 2),
    NEST_HOST                              ("NestHost",                             JDKVersion.JAVA_11, 2),
    NEST_MEMBERS                           ("NestMembers",                          JDKVersion.JAVA_11),
    RECORD                                 ("Record",                               JDKVersion.JAVA_16),
    PERMITTED_SUBCLASSES                   ("PermittedSubclasses",                  JDKVersion.JAVA_17),
    ;

    public static final int VARIABLE_LENGTH = -1;

    /**
     * 属性名字, 通过名字来判断是哪个属性
     */
    private final String attributeName;

    /**
     * 首先出现在哪个版本的 jdk 中
     */
    private final JDKVersion since;

    /**
     * 固定长度属性的 attribute_length, 变长属性为 {@link #VARIABLE_LENGTH}
     */
    private final int fixedLength;

    AttributeType(String attributeName, JDKVersion since) {
        this(attributeName, since, VARIABLE_LENGTH);
    }

    public boolean isFixedLength() {
        return fixedLength != VARIABLE_LENGTH;
    }

    private static final Map<String, AttributeType> name2Instance = new HashMap<>();

    static {
        Arrays.stream(values()).forEach(attr -> name2Instance.put(attr.attributeName, attr));
    }

    /**
     * @return 名字对应的属性, 不认识的名字返回 null
     */
    public static AttributeType getByName(String name) {
        return name2Instance.get(name);
    }

    @Override
    public String toString() {
        return attributeName;
    }
}
