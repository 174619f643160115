package github.yuhongye.classfile.parser;

import github.yuhongye.classfile.constant.ConstantInfo;
import github.yuhongye.classfile.constant.ConstantPool;
import github.yuhongye.classfile.constant.ConstantTag;
import github.yuhongye.classfile.constant.ReferenceKind;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import github.yuhongye.classfile.exceptions.MalformedModifiedUtf8Exception;
import github.yuhongye.classfile.util.ModifiedUtf8;
import github.yuhongye.classfile.util.RawBytes;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_CLASS_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_DOUBLE_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_DYNAMIC_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_FIELDREF_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_FLOAT_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_INTEGER_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_INTERFACEMETHODREF_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_INVOKEDYNAMIC_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_LONG_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_METHODHANDLE_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_METHODREF_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_METHODTYPE_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_MODULE_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_NAMEANDTYPE_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_PACKAGE_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_STRING_INFO;
import static github.yuhongye.classfile.constant.ConstantTag.CONSTANT_UTF8_INFO;

/**
 * 常量池结构:
 * u2 constant_pool_count;
 * cp_info constant_pool[constant_pool_count - 1]; // 索引从1-constant_pool_count-1, 0 属性保留索引
 *
 * cp_info {
 *     u1 tag;
 *     u1 info[];
 * }
 */
@Slf4j
public final class ConstantPoolParser {

    @FunctionalInterface
    interface ConstantReader {
        ConstantInfo read(ClassInput in) throws IOException;
    }

    private static final Map<ConstantTag, ConstantReader> constantTagParser = new EnumMap<>(ConstantTag.class);
    static {
        constantTagParser.put(CONSTANT_UTF8_INFO,               ConstantPoolParser::readUtf8);
        constantTagParser.put(CONSTANT_INTEGER_INFO,            in -> new ConstantInfo.IntegerInfo(in.bytes(4)));
        constantTagParser.put(CONSTANT_FLOAT_INFO,              in -> new ConstantInfo.FloatInfo(in.bytes(4)));
        constantTagParser.put(CONSTANT_LONG_INFO,               in -> new ConstantInfo.LongInfo(in.u4(), in.u4()));
        constantTagParser.put(CONSTANT_DOUBLE_INFO,             in -> new ConstantInfo.DoubleInfo(in.u4(), in.u4()));

        constantTagParser.put(CONSTANT_CLASS_INFO,              in -> new ConstantInfo.ClassInfo(in.u2()));
        constantTagParser.put(CONSTANT_STRING_INFO,             in -> new ConstantInfo.StringInfo(in.u2()));

        constantTagParser.put(CONSTANT_FIELDREF_INFO,           in -> new ConstantInfo.FieldRefInfo(in.u2(), in.u2()));
        constantTagParser.put(CONSTANT_METHODREF_INFO,          in -> new ConstantInfo.MethodRefInfo(in.u2(), in.u2()));
        constantTagParser.put(CONSTANT_INTERFACEMETHODREF_INFO, in -> new ConstantInfo.InterfaceMethodRefInfo(in.u2(), in.u2()));
        constantTagParser.put(CONSTANT_NAMEANDTYPE_INFO,        in -> new ConstantInfo.NameAndTypeInfo(in.u2(), in.u2()));

        constantTagParser.put(CONSTANT_METHODHANDLE_INFO,       ConstantPoolParser::readMethodHandle);
        constantTagParser.put(CONSTANT_METHODTYPE_INFO,         in -> new ConstantInfo.MethodTypeInfo(in.u2()));
        constantTagParser.put(CONSTANT_DYNAMIC_INFO,            in -> new ConstantInfo.DynamicInfo(in.u2(), in.u2()));
        constantTagParser.put(CONSTANT_INVOKEDYNAMIC_INFO,      in -> new ConstantInfo.InvokeDynamicInfo(in.u2(), in.u2()));

        constantTagParser.put(CONSTANT_MODULE_INFO,             in -> new ConstantInfo.ModuleInfo(in.u2()));
        constantTagParser.put(CONSTANT_PACKAGE_INFO,            in -> new ConstantInfo.PackageInfo(in.u2()));
    }

    private ConstantPoolParser() { }

    /**
     * 读取 constant_pool_count 以及全部常量, 返回的常量池大小总是 constant_pool_count.
     * long 和 double 占两个下标, 第二个下标用占位项填充
     */
    public static ConstantPool read(ClassInput in) throws IOException {
        int count = in.u2();
        log.debug("Constant pool count: {}", count);
        if (count == 0) {
            // 下标 0 是保留的, 所以至少是 1
            throw new MalformedClassFileException(in.getSubject(), "constant_pool_count", "must be at least 0x1, actual: 0x0");
        }
        List<ConstantInfo> entries = new ArrayList<>(count);
        entries.add(ConstantInfo.PLACEHOLDER);

        int i = 1;
        while (i < count) {
            ConstantInfo value = readEntry(in, i);
            log.debug("#{} Read constant pool {}, value: {}", i, value.getTag(), value);
            entries.add(value);
            int slotSize = value.getTag().getSlotSize();
            for (int slot = 1; slot < slotSize && i + slot < count; slot++) {
                entries.add(ConstantInfo.PLACEHOLDER);
            }
            i += slotSize;
        }
        return new ConstantPool(in.getSubject(), entries);
    }

    static ConstantInfo readEntry(ClassInput in, int index) throws IOException {
        int tag = in.u1();
        ConstantTag ctag = ConstantTag.getByTag(tag);
        if (ctag == null) {
            throw MalformedClassFileException.notOneOf(in.getSubject(),
                    "constant_pool[#" + index + "].tag", tag, ConstantTag.allTags());
        }
        try {
            return constantTagParser.get(ctag).read(in);
        } catch (MalformedModifiedUtf8Exception e) {
            throw new MalformedClassFileException(in.getSubject(), "constant_pool[#" + index + "].bytes",
                    "is not valid modified UTF-8: " + e.getMessage(), e);
        }
    }

    static ConstantInfo readUtf8(ClassInput in) throws IOException {
        int length = in.u2();
        RawBytes bytes = in.bytes(length);
        return new ConstantInfo.Utf8Info(bytes, ModifiedUtf8.decode(bytes.toByteArray()));
    }

    static ConstantInfo readMethodHandle(ClassInput in) throws IOException {
        int kind = in.u1();
        ReferenceKind referenceKind = ReferenceKind.getByKind(kind);
        if (referenceKind == null) {
            throw MalformedClassFileException.notOneOf(in.getSubject(),
                    "CONSTANT_MethodHandle_info.reference_kind", kind, ReferenceKind.allKinds());
        }
        int referenceIndex = in.u2();
        return new ConstantInfo.MethodHandleInfo(referenceKind, referenceIndex);
    }
}
