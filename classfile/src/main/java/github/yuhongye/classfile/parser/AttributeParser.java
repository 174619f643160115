package github.yuhongye.classfile.parser;

import github.yuhongye.classfile.attribute.AnnotationDefaultAttribute;
import github.yuhongye.classfile.attribute.AnnotationsAttribute;
import github.yuhongye.classfile.attribute.AttributeInfo;
import github.yuhongye.classfile.attribute.AttributeType;
import github.yuhongye.classfile.attribute.BootstrapMethodsAttribute;
import github.yuhongye.classfile.attribute.CodeAttribute;
import github.yuhongye.classfile.attribute.ConstantValueAttribute;
import github.yuhongye.classfile.attribute.EnclosingMethodAttribute;
import github.yuhongye.classfile.attribute.ExceptionsAttribute;
import github.yuhongye.classfile.attribute.InnerClassesAttribute;
import github.yuhongye.classfile.attribute.LineNumberTableAttribute;
import github.yuhongye.classfile.attribute.LocalVariableTableAttribute;
import github.yuhongye.classfile.attribute.LocalVariableTypeTableAttribute;
import github.yuhongye.classfile.attribute.MarkerAttribute;
import github.yuhongye.classfile.attribute.MethodParametersAttribute;
import github.yuhongye.classfile.attribute.ModuleAttribute;
import github.yuhongye.classfile.attribute.ModuleMainClassAttribute;
import github.yuhongye.classfile.attribute.ModulePackagesAttribute;
import github.yuhongye.classfile.attribute.NestHostAttribute;
import github.yuhongye.classfile.attribute.NestMembersAttribute;
import github.yuhongye.classfile.attribute.ParameterAnnotationsAttribute;
import github.yuhongye.classfile.attribute.PermittedSubclassesAttribute;
import github.yuhongye.classfile.attribute.RecordAttribute;
import github.yuhongye.classfile.attribute.SignatureAttribute;
import github.yuhongye.classfile.attribute.SourceDebugExtensionAttribute;
import github.yuhongye.classfile.attribute.SourceFileAttribute;
import github.yuhongye.classfile.attribute.StackMapTableAttribute;
import github.yuhongye.classfile.attribute.TypeAnnotationsAttribute;
import github.yuhongye.classfile.attribute.annotation.Annotation;
import github.yuhongye.classfile.attribute.stackmap.StackMapFrame;
import github.yuhongye.classfile.constant.ConstantPool;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import github.yuhongye.classfile.util.RawBytes;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 解析 attribute_info. 属性没有 tag, 只能先通过 attribute_name_index 在常量池中找到名字, 再按名字解析后面的内容
 */
@Slf4j
public class AttributeParser {

    @FunctionalInterface
    interface AttributeReader {
        AttributeInfo read(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException;
    }

    private final ConstantPool constantPool;
    private final ParserOptions options;
    /** 所在 class 文件的主版本号, 用来提示属性是否比 class 文件版本还新 */
    private final int majorVersion;

    private final Map<AttributeType, AttributeReader> attributeParser = new EnumMap<>(AttributeType.class);

    public AttributeParser(ConstantPool constantPool, ParserOptions options, int majorVersion) {
        this.constantPool = constantPool;
        this.options = options;
        this.majorVersion = majorVersion;

        attributeParser.put(AttributeType.CONSTANT_VALUE,
                (in, type, nameIndex, length) -> new ConstantValueAttribute(nameIndex, length, in.u2()));
        attributeParser.put(AttributeType.CODE, this::readCode);
        attributeParser.put(AttributeType.STACK_MAP_TABLE, this::readStackMapTable);
        attributeParser.put(AttributeType.EXCEPTIONS,
                (in, type, nameIndex, length) -> new ExceptionsAttribute(nameIndex, length, readIndexes(in)));
        attributeParser.put(AttributeType.INNER_CLASSES, this::readInnerClasses);
        attributeParser.put(AttributeType.ENCLOSING_METHOD,
                (in, type, nameIndex, length) -> new EnclosingMethodAttribute(nameIndex, length, in.u2(), in.u2()));
        attributeParser.put(AttributeType.SYNTHETIC,
                (in, type, nameIndex, length) -> new MarkerAttribute(type, nameIndex, length));
        attributeParser.put(AttributeType.SIGNATURE,
                (in, type, nameIndex, length) -> new SignatureAttribute(nameIndex, length, in.u2()));
        attributeParser.put(AttributeType.SOURCE_FILE,
                (in, type, nameIndex, length) -> new SourceFileAttribute(nameIndex, length, in.u2()));
        attributeParser.put(AttributeType.SOURCE_DEBUG_EXTENSION,
                (in, type, nameIndex, length) -> new SourceDebugExtensionAttribute(nameIndex, length, in.bytes(length)));
        attributeParser.put(AttributeType.LINE_NUMBER_TABLE, this::readLineNumberTable);
        attributeParser.put(AttributeType.LOCAL_VARIABLE_TABLE, this::readLocalVariableTable);
        attributeParser.put(AttributeType.LOCAL_VARIABLE_TYPE_TABLE, this::readLocalVariableTypeTable);
        attributeParser.put(AttributeType.DEPRECATED,
                (in, type, nameIndex, length) -> new MarkerAttribute(type, nameIndex, length));

        AttributeReader annotations = (in, type, nameIndex, length) ->
                new AnnotationsAttribute(type, nameIndex, length, AnnotationParser.readAnnotations(in));
        attributeParser.put(AttributeType.RUNTIME_VISIBLE_ANNOTATIONS, annotations);
        attributeParser.put(AttributeType.RUNTIME_INVISIBLE_ANNOTATIONS, annotations);
        attributeParser.put(AttributeType.RUNTIME_VISIBLE_PARAMETER_ANNOTATIONS, this::readParameterAnnotations);
        attributeParser.put(AttributeType.RUNTIME_INVISIBLE_PARAMETER_ANNOTATIONS, this::readParameterAnnotations);
        AttributeReader typeAnnotations = (in, type, nameIndex, length) ->
                new TypeAnnotationsAttribute(type, nameIndex, length, AnnotationParser.readTypeAnnotations(in));
        attributeParser.put(AttributeType.RUNTIME_VISIBLE_TYPE_ANNOTATIONS, typeAnnotations);
        attributeParser.put(AttributeType.RUNTIME_INVISIBLE_TYPE_ANNOTATIONS, typeAnnotations);
        attributeParser.put(AttributeType.ANNOTATION_DEFAULT,
                (in, type, nameIndex, length) ->
                        new AnnotationDefaultAttribute(nameIndex, length, AnnotationParser.readElementValue(in)));

        attributeParser.put(AttributeType.BOOTSTRAP_METHODS, this::readBootstrapMethods);
        attributeParser.put(AttributeType.METHOD_PARAMETERS, this::readMethodParameters);
        attributeParser.put(AttributeType.MODULE, this::readModule);
        attributeParser.put(AttributeType.MODULE_PACKAGES,
                (in, type, nameIndex, length) -> new ModulePackagesAttribute(nameIndex, length, readIndexes(in)));
        attributeParser.put(AttributeType.MODULE_MAIN_CLASS,
                (in, type, nameIndex, length) -> new ModuleMainClassAttribute(nameIndex, length, in.u2()));
        attributeParser.put(AttributeType.NEST_HOST,
                (in, type, nameIndex, length) -> new NestHostAttribute(nameIndex, length, in.u2()));
        attributeParser.put(AttributeType.NEST_MEMBERS,
                (in, type, nameIndex, length) -> new NestMembersAttribute(nameIndex, length, readIndexes(in)));
        attributeParser.put(AttributeType.RECORD, this::readRecord);
        attributeParser.put(AttributeType.PERMITTED_SUBCLASSES,
                (in, type, nameIndex, length) -> new PermittedSubclassesAttribute(nameIndex, length, readIndexes(in)));
    }

    /**
     * u2             attributes_count;
     * attribute_info attributes[attributes_count];
     */
    public List<AttributeInfo> readAttributes(ClassInput in) throws IOException {
        int count = in.u2();
        List<AttributeInfo> attributes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            attributes.add(readAttribute(in));
        }
        return attributes;
    }

    public AttributeInfo readAttribute(ClassInput in) throws IOException {
        int nameIndex = in.u2();
        long length = in.u4();
        AttributeType type = getAttributeType(in, nameIndex);
        log.debug("Attribute name index: {}, attribute: {}, length: {}", nameIndex, type, length);
        if (majorVersion < type.getSince().getMajor()) {
            log.debug("Attribute {} appears in a class file of major version {}, it was introduced in {}",
                    type, majorVersion, type.getSince());
        }

        String lengthField = type.getAttributeName() + ".attribute_length";
        if (options.isCheckAttributeLength() && type.isFixedLength() && length != type.getFixedLength()) {
            throw MalformedClassFileException.wrongValue(in.getSubject(), lengthField, length, type.getFixedLength());
        }

        long start = in.position();
        AttributeInfo attribute = attributeParser.get(type).read(in, type, nameIndex, length);
        long consumed = in.position() - start;
        if (options.isCheckAttributeLength() && consumed != length) {
            throw new MalformedClassFileException(in.getSubject(), lengthField,
                    "does not match the attribute body, declared: " + MalformedClassFileException.hex(length)
                            + ", consumed: " + MalformedClassFileException.hex(consumed));
        }
        return attribute;
    }

    /**
     * Attribute 结构的第一个字段都是 attribute_name_index, 它必须是对常量池的一个有效索引,
     * 并且该常量必须是 Constant_Utf8_info 结构
     */
    private AttributeType getAttributeType(ClassInput in, int nameIndex) {
        String name = constantPool.getUtf8(nameIndex, "attribute_name_index");
        AttributeType type = AttributeType.getByName(name);
        if (type == null) {
            throw MalformedClassFileException.unknownName(in.getSubject(), "attribute_name_index", name);
        }
        return type;
    }

    private AttributeInfo readCode(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int maxStack = in.u2();
        int maxLocals = in.u2();
        long codeLength = in.u4();
        RawBytes code = in.bytes(codeLength);

        int exceptionTableLength = in.u2();
        List<CodeAttribute.ExceptionTableEntry> exceptionTable = new ArrayList<>(exceptionTableLength);
        for (int i = 0; i < exceptionTableLength; i++) {
            exceptionTable.add(new CodeAttribute.ExceptionTableEntry(in.u2(), in.u2(), in.u2(), in.u2()));
        }
        List<AttributeInfo> attributes = readAttributes(in);
        return new CodeAttribute(nameIndex, length, maxStack, maxLocals, code, exceptionTable, attributes);
    }

    private AttributeInfo readStackMapTable(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int numberOfEntries = in.u2();
        List<StackMapFrame> entries = new ArrayList<>(numberOfEntries);
        for (int i = 0; i < numberOfEntries; i++) {
            entries.add(StackMapFrameParser.readFrame(in));
        }
        return new StackMapTableAttribute(nameIndex, length, entries);
    }

    private AttributeInfo readInnerClasses(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int numberOfClasses = in.u2();
        List<InnerClassesAttribute.InnerClass> classes = new ArrayList<>(numberOfClasses);
        for (int i = 0; i < numberOfClasses; i++) {
            classes.add(new InnerClassesAttribute.InnerClass(in.u2(), in.u2(), in.u2(), in.u2()));
        }
        return new InnerClassesAttribute(nameIndex, length, classes);
    }

    private AttributeInfo readLineNumberTable(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int tableLength = in.u2();
        List<LineNumberTableAttribute.LineNumber> table = new ArrayList<>(tableLength);
        for (int i = 0; i < tableLength; i++) {
            table.add(new LineNumberTableAttribute.LineNumber(in.u2(), in.u2()));
        }
        return new LineNumberTableAttribute(nameIndex, length, table);
    }

    private AttributeInfo readLocalVariableTable(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int tableLength = in.u2();
        List<LocalVariableTableAttribute.LocalVariable> table = new ArrayList<>(tableLength);
        for (int i = 0; i < tableLength; i++) {
            table.add(new LocalVariableTableAttribute.LocalVariable(in.u2(), in.u2(), in.u2(), in.u2(), in.u2()));
        }
        return new LocalVariableTableAttribute(nameIndex, length, table);
    }

    private AttributeInfo readLocalVariableTypeTable(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int tableLength = in.u2();
        List<LocalVariableTypeTableAttribute.LocalVariableType> table = new ArrayList<>(tableLength);
        for (int i = 0; i < tableLength; i++) {
            table.add(new LocalVariableTypeTableAttribute.LocalVariableType(in.u2(), in.u2(), in.u2(), in.u2(), in.u2()));
        }
        return new LocalVariableTypeTableAttribute(nameIndex, length, table);
    }

    /**
     * num_parameters 是 u1
     */
    private AttributeInfo readParameterAnnotations(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int numParameters = in.u1();
        List<List<Annotation>> parameterAnnotations = new ArrayList<>(numParameters);
        for (int i = 0; i < numParameters; i++) {
            parameterAnnotations.add(AnnotationParser.readAnnotations(in));
        }
        return new ParameterAnnotationsAttribute(type, nameIndex, length, parameterAnnotations);
    }

    private AttributeInfo readBootstrapMethods(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int numBootstrapMethods = in.u2();
        List<BootstrapMethodsAttribute.BootstrapMethod> methods = new ArrayList<>(numBootstrapMethods);
        for (int i = 0; i < numBootstrapMethods; i++) {
            int bootstrapMethodRef = in.u2();
            methods.add(new BootstrapMethodsAttribute.BootstrapMethod(bootstrapMethodRef, readIndexes(in)));
        }
        return new BootstrapMethodsAttribute(nameIndex, length, methods);
    }

    private AttributeInfo readMethodParameters(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int parametersCount = in.u1();
        List<MethodParametersAttribute.Parameter> parameters = new ArrayList<>(parametersCount);
        for (int i = 0; i < parametersCount; i++) {
            parameters.add(new MethodParametersAttribute.Parameter(in.u2(), in.u2()));
        }
        return new MethodParametersAttribute(nameIndex, length, parameters);
    }

    private AttributeInfo readModule(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int moduleNameIndex = in.u2();
        int moduleFlags = in.u2();
        int moduleVersionIndex = in.u2();

        int requiresCount = in.u2();
        List<ModuleAttribute.Requires> requires = new ArrayList<>(requiresCount);
        for (int i = 0; i < requiresCount; i++) {
            requires.add(new ModuleAttribute.Requires(in.u2(), in.u2(), in.u2()));
        }

        int exportsCount = in.u2();
        List<ModuleAttribute.Exports> exports = new ArrayList<>(exportsCount);
        for (int i = 0; i < exportsCount; i++) {
            int exportsIndex = in.u2();
            int exportsFlags = in.u2();
            exports.add(new ModuleAttribute.Exports(exportsIndex, exportsFlags, readIndexes(in)));
        }

        int opensCount = in.u2();
        List<ModuleAttribute.Opens> opens = new ArrayList<>(opensCount);
        for (int i = 0; i < opensCount; i++) {
            int opensIndex = in.u2();
            int opensFlags = in.u2();
            opens.add(new ModuleAttribute.Opens(opensIndex, opensFlags, readIndexes(in)));
        }

        List<Integer> usesIndex = readIndexes(in);

        int providesCount = in.u2();
        List<ModuleAttribute.Provides> provides = new ArrayList<>(providesCount);
        for (int i = 0; i < providesCount; i++) {
            int providesIndex = in.u2();
            provides.add(new ModuleAttribute.Provides(providesIndex, readIndexes(in)));
        }
        return new ModuleAttribute(nameIndex, length, moduleNameIndex, moduleFlags, moduleVersionIndex,
                requires, exports, opens, usesIndex, provides);
    }

    private AttributeInfo readRecord(ClassInput in, AttributeType type, int nameIndex, long length) throws IOException {
        int componentsCount = in.u2();
        List<RecordAttribute.RecordComponent> components = new ArrayList<>(componentsCount);
        for (int i = 0; i < componentsCount; i++) {
            int componentNameIndex = in.u2();
            int descriptorIndex = in.u2();
            components.add(new RecordAttribute.RecordComponent(componentNameIndex, descriptorIndex, readAttributes(in)));
        }
        return new RecordAttribute(nameIndex, length, components);
    }

    /**
     * u2 count; u2 index[count];
     */
    private static List<Integer> readIndexes(ClassInput in) throws IOException {
        int count = in.u2();
        List<Integer> indexes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            indexes.add(in.u2());
        }
        return indexes;
    }
}
