package github.yuhongye.classfile.parser;

import github.yuhongye.classfile.ClassFileBuilder;
import github.yuhongye.classfile.ClassFileBuilder.Bytes;
import github.yuhongye.classfile.constant.ConstantInfo;
import github.yuhongye.classfile.constant.ConstantPool;
import github.yuhongye.classfile.constant.ConstantTag;
import github.yuhongye.classfile.constant.ReferenceKind;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import github.yuhongye.classfile.exceptions.MalformedModifiedUtf8Exception;
import org.junit.Test;

import java.io.EOFException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ConstantPoolParserTest {

    @Test
    public void testAllTags() throws Exception {
        ClassFileBuilder b = new ClassFileBuilder();
        int hello = b.utf8("Hello");
        int integer = b.integer(-1);
        int flt = b.floatValue(1.5f);
        int lng = b.longValue(0x123456789ABCDEF0L);
        int dbl = b.doubleValue(2.5);
        int object = b.classRef("java/lang/Object");
        int str = b.string("str");
        int nat = b.nameAndType("foo", "()V");
        int fieldRef = b.fieldRef(object, nat);
        int methodRef = b.methodRef(object, nat);
        int interfaceMethodRef = b.interfaceMethodRef(object, nat);
        int handle = b.methodHandle(6, methodRef);
        int methodType = b.methodType("()V");
        int dynamic = b.dynamic(0, nat);
        int indy = b.invokeDynamic(1, nat);
        int module = b.module("java.base");
        int pkg = b.packageRef("a/b");

        ConstantPool pool = b.constantPool();
        assertEquals(b.getPoolCount(), pool.size());
        assertSame(ConstantInfo.PLACEHOLDER, pool.getEntries().get(0));

        assertEquals("Hello", pool.getUtf8(hello, "test"));
        assertEquals(-1, pool.get(integer, ConstantInfo.IntegerInfo.class, "test").intValue());
        assertEquals(1.5f, pool.get(flt, ConstantInfo.FloatInfo.class, "test").floatValue(), 0f);

        ConstantInfo.LongInfo longInfo = pool.get(lng, ConstantInfo.LongInfo.class, "test");
        assertEquals(0x12345678L, longInfo.getHighBytes());
        assertEquals(0x9ABCDEF0L, longInfo.getLowBytes());
        assertEquals(0x123456789ABCDEF0L, longInfo.longValue());
        assertTrue(pool.getEntries().get(lng + 1).isPlaceholder());

        assertEquals(2.5, pool.get(dbl, ConstantInfo.DoubleInfo.class, "test").doubleValue(), 0);
        assertTrue(pool.getEntries().get(dbl + 1).isPlaceholder());

        assertEquals("java/lang/Object", pool.getClassName(object, "test"));
        ConstantInfo.StringInfo stringInfo = pool.get(str, ConstantInfo.StringInfo.class, "test");
        assertEquals("str", pool.getUtf8(stringInfo.getStringIndex(), "test"));

        ConstantInfo.NameAndTypeInfo natInfo = pool.get(nat, ConstantInfo.NameAndTypeInfo.class, "test");
        assertEquals("foo", pool.getUtf8(natInfo.getNameIndex(), "test"));
        assertEquals("()V", pool.getUtf8(natInfo.getDescriptorIndex(), "test"));

        assertMemberRef(pool.get(fieldRef, "test"), ConstantTag.CONSTANT_FIELDREF_INFO, object, nat);
        assertMemberRef(pool.get(methodRef, "test"), ConstantTag.CONSTANT_METHODREF_INFO, object, nat);
        assertMemberRef(pool.get(interfaceMethodRef, "test"), ConstantTag.CONSTANT_INTERFACEMETHODREF_INFO, object, nat);

        ConstantInfo.MethodHandleInfo handleInfo = pool.get(handle, ConstantInfo.MethodHandleInfo.class, "test");
        assertEquals(ReferenceKind.REF_INVOKE_STATIC, handleInfo.getReferenceKind());
        assertEquals(methodRef, handleInfo.getReferenceIndex());

        ConstantInfo.MethodTypeInfo methodTypeInfo = pool.get(methodType, ConstantInfo.MethodTypeInfo.class, "test");
        assertEquals("()V", pool.getUtf8(methodTypeInfo.getDescriptorIndex(), "test"));

        ConstantInfo.DynamicInfo dynamicInfo = pool.get(dynamic, ConstantInfo.DynamicInfo.class, "test");
        assertEquals(0, dynamicInfo.getBootstrapMethodAttrIndex());
        assertEquals(nat, dynamicInfo.getNameAndTypeIndex());
        ConstantInfo.InvokeDynamicInfo indyInfo = pool.get(indy, ConstantInfo.InvokeDynamicInfo.class, "test");
        assertEquals(1, indyInfo.getBootstrapMethodAttrIndex());

        ConstantInfo.ModuleInfo moduleInfo = pool.get(module, ConstantInfo.ModuleInfo.class, "test");
        assertEquals("java.base", pool.getUtf8(moduleInfo.getNameIndex(), "test"));
        ConstantInfo.PackageInfo packageInfo = pool.get(pkg, ConstantInfo.PackageInfo.class, "test");
        assertEquals("a/b", pool.getUtf8(packageInfo.getNameIndex(), "test"));
    }

    private static void assertMemberRef(ConstantInfo value, ConstantTag tag, int classIndex, int natIndex) {
        assertEquals(tag, value.getTag());
        ConstantInfo.MemberRefInfo ref = (ConstantInfo.MemberRefInfo) value;
        assertEquals(classIndex, ref.getClassIndex());
        assertEquals(natIndex, ref.getNameAndTypeIndex());
    }

    @Test
    public void testPoolSizeEqualsCount() throws Exception {
        ConstantPool pool = ConstantPoolParser.read(new Bytes().u2(1).input());
        assertEquals(1, pool.size());
        assertTrue(pool.getEntries().get(0).isPlaceholder());

        // long 在最后一个下标, 第二个槽位超出 constant_pool_count
        Bytes bytes = new Bytes().u2(3)
                .u1(1).utf("A")
                .u1(5).u4(0).u4(42);
        pool = ConstantPoolParser.read(bytes.input());
        assertEquals(3, pool.size());
        assertEquals(42L, pool.get(2, ConstantInfo.LongInfo.class, "test").longValue());
    }

    @Test
    public void testZeroCount() {
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class,
                () -> ConstantPoolParser.read(new Bytes().u2(0).input()));
        assertEquals("constant_pool_count", e.getField());
    }

    @Test
    public void testUnknownTag() {
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class,
                () -> ConstantPoolParser.read(new Bytes().u2(2).u1(2).input()));
        assertEquals(ClassFileBuilder.SUBJECT, e.getSubject());
        assertEquals("constant_pool[#1].tag", e.getField());
        assertEquals("Malformed class file Fixture.class: constant_pool[#1].tag has wrong value, expected one of: "
                + "[0x1, 0x3, 0x4, 0x5, 0x6, 0x7, 0x8, 0x9, 0xa, 0xb, 0xc, 0xf, 0x10, 0x11, 0x12, 0x13, 0x14], "
                + "actual: 0x2", e.getMessage());
    }

    @Test
    public void testInvalidReferenceKind() {
        ClassFileBuilder b = new ClassFileBuilder();
        b.methodHandle(0x0A, 1);
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class, b::constantPool);
        assertEquals("CONSTANT_MethodHandle_info.reference_kind", e.getField());
        assertTrue(e.getMessage(), e.getMessage().endsWith(
                "expected one of: [0x1, 0x2, 0x3, 0x4, 0x5, 0x6, 0x7, 0x8, 0x9], actual: 0xa"));
    }

    @Test
    public void testMalformedUtf8NamesPoolIndex() {
        ClassFileBuilder b = new ClassFileBuilder();
        b.utf8("ok");
        b.utf8Raw(0x41, 0x00);
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class, b::constantPool);
        assertEquals("constant_pool[#2].bytes", e.getField());
        assertTrue(e.getCause() instanceof MalformedModifiedUtf8Exception);
        assertEquals(1, ((MalformedModifiedUtf8Exception) e.getCause()).getOffset());
    }

    @Test
    public void testTruncatedEntry() {
        assertThrows(EOFException.class, () -> ConstantPoolParser.read(new Bytes().u2(2).u1(7).u1(0).input()));
        assertThrows(EOFException.class, () -> ConstantPoolParser.read(new Bytes().u2(3).u1(1).utf("x").input()));
    }
}
