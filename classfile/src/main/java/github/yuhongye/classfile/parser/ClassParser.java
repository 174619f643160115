package github.yuhongye.classfile.parser;

import github.yuhongye.classfile.ClassFile;
import github.yuhongye.classfile.FieldInfo;
import github.yuhongye.classfile.MethodInfo;
import github.yuhongye.classfile.attribute.AttributeInfo;
import github.yuhongye.classfile.constant.ConstantPool;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import github.yuhongye.classfile.meta.ClassAcc;
import github.yuhongye.classfile.meta.JDKVersion;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 按顺序解析 class 文件: magic, 版本号, 常量池, 访问标志, this/super, 接口, 字段, 方法, 属性.
 * 每次 parse 都使用自己的 {@link ClassInput}, 同一个 ClassParser 可以被多个线程共享
 */
@Slf4j
public class ClassParser {
    public static final long MAGIC = 0xCAFEBABEL;

    @Getter
    private final ParserOptions options;

    public ClassParser() {
        this(ParserOptions.DEFAULT);
    }

    public ClassParser(ParserOptions options) {
        this.options = options;
    }

    public ClassFile parse(Path path) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return parse(in, path.toString());
        }
    }

    public ClassFile parse(byte[] bytes, String subject) throws IOException {
        return parse(new ByteArrayInputStream(bytes), subject);
    }

    /**
     * 不会关闭 source
     *
     * @param subject 出错时用来标识是哪个文件
     */
    public ClassFile parse(InputStream source, String subject) throws IOException {
        ClassInput in = new ClassInput(source, subject);

        long magic = in.u4();
        if (magic != MAGIC) {
            throw MalformedClassFileException.wrongValue(subject, "magic", magic, MAGIC);
        }
        int minor = in.u2();
        int major = in.u2();
        log.debug("Major version: {}, minor version: {}, JDK version: {}",
                major, minor, JDKVersion.getByMajor(major).map(JDKVersion::toString).orElse("unknown"));

        ConstantPool constantPool = ConstantPoolParser.read(in);
        AttributeParser attributeParser = new AttributeParser(constantPool, options, major);

        int accessFlags = in.u2();
        log.debug("Access flag: {}", ClassAcc.toString(accessFlags));
        int thisClass = in.u2();
        int superClass = in.u2();

        List<Integer> interfaces = readInterfaces(in);
        List<FieldInfo> fields = readFields(in, attributeParser);
        List<MethodInfo> methods = readMethods(in, attributeParser);
        List<AttributeInfo> attributes = attributeParser.readAttributes(in);

        if (options.isRejectTrailingBytes()) {
            long end = in.position();
            if (!in.isAtEnd()) {
                throw new MalformedClassFileException(subject, "attributes",
                        "must be the end of the class file, but more bytes follow at " + MalformedClassFileException.hex(end));
            }
        }

        ClassFile classFile = ClassFile.builder()
                .magic(magic)
                .minorVersion(minor)
                .majorVersion(major)
                .constantPool(constantPool)
                .accessFlags(accessFlags)
                .thisClass(thisClass)
                .superClass(superClass)
                .interfaces(interfaces)
                .fields(fields)
                .methods(methods)
                .attributes(attributes)
                .build();
        log.info("Parsed {}: version {}.{}, {} constant(s), {} field(s), {} method(s), {} attribute(s)",
                subject, major, minor, constantPool.size(), fields.size(), methods.size(), attributes.size());
        return classFile;
    }

    private static List<Integer> readInterfaces(ClassInput in) throws IOException {
        int count = in.u2();
        log.debug("Interface count: {}", count);
        List<Integer> interfaces = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            interfaces.add(in.u2());
        }
        return interfaces;
    }

    /**
     * field_info {
     *     u2 access_flags;
     *     u2 name_index;
     *     u2 descriptor_index;
     *     u2 attributes_count;
     *     attribute_info attributes[attributes_count]
     * }
     */
    private static List<FieldInfo> readFields(ClassInput in, AttributeParser attributeParser) throws IOException {
        int count = in.u2();
        log.debug("Field count: {}", count);
        List<FieldInfo> fields = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int acc = in.u2();
            int nameIndex = in.u2();
            int descIndex = in.u2();
            log.debug("Field access flag: {}, name index: {}, descriptor index: {}",
                    acc, nameIndex, descIndex);
            fields.add(new FieldInfo(acc, nameIndex, descIndex, attributeParser.readAttributes(in)));
        }
        return fields;
    }

    /**
     * method_info {
     *     u2 access_flags;
     *     u2 name_index;
     *     u2 descriptor_index;
     *     u2 attributes_count;
     *     attribute_info attributes[attributes_count];
     * }
     */
    private static List<MethodInfo> readMethods(ClassInput in, AttributeParser attributeParser) throws IOException {
        int count = in.u2();
        log.debug("Method count: {}", count);
        List<MethodInfo> methods = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int acc = in.u2();
            int nameIndex = in.u2();
            int descIndex = in.u2();
            log.debug("Method access flag: {}, name index: {}, descriptor index: {}",
                    acc, nameIndex, descIndex);
            methods.add(new MethodInfo(acc, nameIndex, descIndex, attributeParser.readAttributes(in)));
        }
        return methods;
    }
}
