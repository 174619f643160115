package github.yuhongye.classfile.parser;

import github.yuhongye.classfile.ClassFileBuilder;
import github.yuhongye.classfile.ClassFileBuilder.Bytes;
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
import github.yuhongye.classfile.attribute.annotation.ElementValue;
import github.yuhongye.classfile.attribute.annotation.TargetKind;
import github.yuhongye.classfile.attribute.stackmap.FrameKind;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import github.yuhongye.classfile.util.RawBytes;
import org.junit.Before;
import org.junit.Test;

import java.io.EOFException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class AttributeParserTest {
    private ClassFileBuilder b;

    @Before
    public void setUp() {
        b = new ClassFileBuilder();
    }

    private Bytes attribute(String name, Consumer<Bytes> content) {
        return new Bytes().attribute(b.utf8(name), content);
    }

    private AttributeInfo parse(Bytes bytes) throws Exception {
        ClassInput in = bytes.input();
        AttributeInfo attribute = new AttributeParser(b.constantPool(), ParserOptions.DEFAULT, 61).readAttribute(in);
        assertTrue("attribute must consume all its bytes", in.isAtEnd());
        return attribute;
    }

    @Test
    public void testEveryAttributeNameIsKnown() {
        assertEquals(30, AttributeType.values().length);
        for (AttributeType type : AttributeType.values()) {
            assertSame(type, AttributeType.getByName(type.getAttributeName()));
        }
        assertNull(AttributeType.getByName("RuntimeInVisibleAnnotations"));
    }

    @Test
    public void testConstantValue() throws Exception {
        ConstantValueAttribute attr = (ConstantValueAttribute) parse(attribute("ConstantValue", c -> c.u2(3)));
        assertEquals(AttributeType.CONSTANT_VALUE, attr.getType());
        assertEquals(1, attr.getAttributeNameIndex());
        assertEquals(2, attr.getAttributeLength());
        assertEquals(3, attr.getConstantValueIndex());
    }

    @Test
    public void testCode() throws Exception {
        CodeAttribute code = (CodeAttribute) parse(attribute("Code", c -> c
                .u2(4).u2(2)
                .u4(3).raw(0x2A, 0xB7, 0xB1)
                .u2(0)
                .u2(0)));
        assertEquals(15, code.getAttributeLength());
        assertEquals(4, code.getMaxStack());
        assertEquals(2, code.getMaxLocals());
        assertEquals(RawBytes.of(0x2A, 0xB7, 0xB1), code.getCode());
        assertTrue(code.getExceptionTable().isEmpty());
        assertTrue(code.getAttributes().isEmpty());
    }

    @Test
    public void testCodeWithNestedAttributes() throws Exception {
        CodeAttribute code = (CodeAttribute) parse(attribute("Code", c -> c
                .u2(1).u2(1)
                .u4(1).raw(0xB1)
                .u2(1).u2(0).u2(1).u2(1).u2(0)
                .u2(2)
                .attribute(b.utf8("LineNumberTable"), t -> t.u2(1).u2(0).u2(42))
                .attribute(b.utf8("StackMapTable"), t -> t.u2(1).u1(0))));
        CodeAttribute.ExceptionTableEntry entry = code.getExceptionTable().get(0);
        assertEquals(1, entry.getEndPc());
        assertEquals(1, entry.getHandlerPc());
        assertEquals(0, entry.getCatchType());

        LineNumberTableAttribute lines = (LineNumberTableAttribute)
                code.findAttribute(AttributeType.LINE_NUMBER_TABLE).get();
        assertEquals(42, lines.getLineNumberTable().get(0).getLineNumber());
        StackMapTableAttribute stackMap = (StackMapTableAttribute) code.getAttributes().get(1);
        assertEquals(FrameKind.SAME, stackMap.getEntries().get(0).getKind());
    }

    @Test
    public void testExceptionsAndInnerClasses() throws Exception {
        ExceptionsAttribute exceptions = (ExceptionsAttribute) parse(attribute("Exceptions", c -> c.u2(2).u2(5).u2(6)));
        assertEquals(Arrays.asList(5, 6), exceptions.getExceptionIndexTable());

        InnerClassesAttribute inner = (InnerClassesAttribute) parse(attribute("InnerClasses",
                c -> c.u2(1).u2(7).u2(8).u2(9).u2(0x0009)));
        InnerClassesAttribute.InnerClass cls = inner.getClasses().get(0);
        assertEquals(7, cls.getInnerClassInfoIndex());
        assertEquals(8, cls.getOuterClassInfoIndex());
        assertEquals(9, cls.getInnerNameIndex());
        assertTrue(cls.getAccessDescription().contains("ACC_PUBLIC"));
        assertTrue(cls.getAccessDescription().contains("ACC_STATIC"));
    }

    @Test
    public void testSmallFixedAttributes() throws Exception {
        EnclosingMethodAttribute enclosing = (EnclosingMethodAttribute) parse(attribute("EnclosingMethod",
                c -> c.u2(3).u2(0)));
        assertEquals(3, enclosing.getClassIndex());
        assertEquals(0, enclosing.getMethodIndex());

        MarkerAttribute synthetic = (MarkerAttribute) parse(attribute("Synthetic", c -> { }));
        assertEquals(AttributeType.SYNTHETIC, synthetic.getType());
        MarkerAttribute deprecated = (MarkerAttribute) parse(attribute("Deprecated", c -> { }));
        assertEquals(AttributeType.DEPRECATED, deprecated.getType());
        assertEquals(0, deprecated.getAttributeLength());

        assertEquals(4, ((SignatureAttribute) parse(attribute("Signature", c -> c.u2(4)))).getSignatureIndex());
        assertEquals(5, ((SourceFileAttribute) parse(attribute("SourceFile", c -> c.u2(5)))).getSourceFileIndex());
        assertEquals(6, ((ModuleMainClassAttribute) parse(attribute("ModuleMainClass", c -> c.u2(6)))).getMainClassIndex());
        assertEquals(7, ((NestHostAttribute) parse(attribute("NestHost", c -> c.u2(7)))).getHostClassIndex());
    }

    @Test
    public void testSourceDebugExtension() throws Exception {
        SourceDebugExtensionAttribute attr = (SourceDebugExtensionAttribute) parse(attribute("SourceDebugExtension",
                c -> c.raw('S', 'M', 'A', 'P')));
        assertEquals(4, attr.getAttributeLength());
        assertEquals(RawBytes.of('S', 'M', 'A', 'P'), attr.getDebugExtension());
    }

    @Test
    public void testLocalVariableTables() throws Exception {
        LocalVariableTableAttribute table = (LocalVariableTableAttribute) parse(attribute("LocalVariableTable",
                c -> c.u2(1).u2(0).u2(5).u2(10).u2(11).u2(0)));
        LocalVariableTableAttribute.LocalVariable var = table.getLocalVariableTable().get(0);
        assertEquals(5, var.getLength());
        assertEquals(10, var.getNameIndex());
        assertEquals(11, var.getDescriptorIndex());

        LocalVariableTypeTableAttribute typeTable = (LocalVariableTypeTableAttribute) parse(attribute(
                "LocalVariableTypeTable", c -> c.u2(1).u2(2).u2(3).u2(12).u2(13).u2(1)));
        LocalVariableTypeTableAttribute.LocalVariableType type = typeTable.getLocalVariableTypeTable().get(0);
        assertEquals(2, type.getStartPc());
        assertEquals(13, type.getSignatureIndex());
        assertEquals(1, type.getIndex());
    }

    @Test
    public void testAnnotations() throws Exception {
        AnnotationsAttribute visible = (AnnotationsAttribute) parse(attribute("RuntimeVisibleAnnotations",
                c -> c.u2(1).u2(7).u2(0)));
        assertTrue(visible.isVisible());
        assertEquals(7, visible.getAnnotations().get(0).getTypeIndex());

        AnnotationsAttribute invisible = (AnnotationsAttribute) parse(attribute("RuntimeInvisibleAnnotations",
                c -> c.u2(0)));
        assertFalse(invisible.isVisible());
        assertEquals(AttributeType.RUNTIME_INVISIBLE_ANNOTATIONS, invisible.getType());
    }

    @Test
    public void testParameterAnnotations() throws Exception {
        ParameterAnnotationsAttribute visible = (ParameterAnnotationsAttribute) parse(attribute(
                "RuntimeVisibleParameterAnnotations", c -> c.u1(2).u2(0).u2(1).u2(7).u2(0)));
        assertTrue(visible.isVisible());
        assertEquals(2, visible.getParameterAnnotations().size());
        assertTrue(visible.getParameterAnnotations().get(0).isEmpty());
        assertEquals(7, visible.getParameterAnnotations().get(1).get(0).getTypeIndex());

        ParameterAnnotationsAttribute invisible = (ParameterAnnotationsAttribute) parse(attribute(
                "RuntimeInvisibleParameterAnnotations", c -> c.u1(0)));
        assertFalse(invisible.isVisible());
    }

    @Test
    public void testTypeAnnotations() throws Exception {
        TypeAnnotationsAttribute visible = (TypeAnnotationsAttribute) parse(attribute(
                "RuntimeVisibleTypeAnnotations", c -> c.u2(1).u1(0x13).u1(0).u2(9).u2(0)));
        assertTrue(visible.isVisible());
        assertEquals(TargetKind.EMPTY, visible.getAnnotations().get(0).getTargetInfo().getKind());

        TypeAnnotationsAttribute invisible = (TypeAnnotationsAttribute) parse(attribute(
                "RuntimeInvisibleTypeAnnotations", c -> c.u2(1).u1(0x42).u2(3).u1(0).u2(9).u2(0)));
        assertFalse(invisible.isVisible());
        assertEquals(TargetKind.CATCH, invisible.getAnnotations().get(0).getTargetInfo().getKind());
    }

    @Test
    public void testAnnotationDefault() throws Exception {
        AnnotationDefaultAttribute attr = (AnnotationDefaultAttribute) parse(attribute("AnnotationDefault",
                c -> c.u1('I').u2(4)));
        assertEquals(4, ((ElementValue.ConstValue) attr.getDefaultValue()).getConstValueIndex());
    }

    @Test
    public void testBootstrapMethodsAndMethodParameters() throws Exception {
        BootstrapMethodsAttribute bootstrap = (BootstrapMethodsAttribute) parse(attribute("BootstrapMethods",
                c -> c.u2(1).u2(10).u2(2).u2(11).u2(12)));
        BootstrapMethodsAttribute.BootstrapMethod method = bootstrap.getBootstrapMethods().get(0);
        assertEquals(10, method.getBootstrapMethodRef());
        assertEquals(Arrays.asList(11, 12), method.getBootstrapArguments());

        MethodParametersAttribute parameters = (MethodParametersAttribute) parse(attribute("MethodParameters",
                c -> c.u1(2).u2(5).u2(0x0010).u2(0).u2(0x8000)));
        assertEquals(2, parameters.getParameters().size());
        assertEquals(0x0010, parameters.getParameters().get(0).getAccessFlags());
        assertEquals(0, parameters.getParameters().get(1).getNameIndex());
    }

    @Test
    public void testModule() throws Exception {
        ModuleAttribute module = (ModuleAttribute) parse(attribute("Module", c -> c
                .u2(1).u2(0x0020).u2(0)
                .u2(1).u2(2).u2(0x8000).u2(3)
                .u2(1).u2(4).u2(0).u2(2).u2(5).u2(6)
                .u2(1).u2(7).u2(0).u2(0)
                .u2(1).u2(8)
                .u2(1).u2(9).u2(2).u2(10).u2(11)));
        assertEquals(0x0020, module.getModuleFlags());
        assertEquals(3, module.getRequires().get(0).getRequiresVersionIndex());
        assertEquals(Arrays.asList(5, 6), module.getExports().get(0).getExportsToIndex());
        assertTrue(module.getOpens().get(0).getOpensToIndex().isEmpty());
        assertEquals(Arrays.asList(8), module.getUsesIndex());
        assertEquals(9, module.getProvides().get(0).getProvidesIndex());
        assertEquals(Arrays.asList(10, 11), module.getProvides().get(0).getProvidesWithIndex());

        ModulePackagesAttribute packages = (ModulePackagesAttribute) parse(attribute("ModulePackages",
                c -> c.u2(2).u2(3).u2(4)));
        assertEquals(Arrays.asList(3, 4), packages.getPackageIndex());
    }

    @Test
    public void testNestsRecordAndPermittedSubclasses() throws Exception {
        NestMembersAttribute members = (NestMembersAttribute) parse(attribute("NestMembers", c -> c.u2(1).u2(5)));
        assertEquals(Arrays.asList(5), members.getClasses());

        PermittedSubclassesAttribute permitted = (PermittedSubclassesAttribute) parse(attribute("PermittedSubclasses",
                c -> c.u2(2).u2(6).u2(7)));
        assertEquals(Arrays.asList(6, 7), permitted.getClasses());

        RecordAttribute record = (RecordAttribute) parse(attribute("Record", c -> c
                .u2(1).u2(8).u2(9)
                .u2(1).attribute(b.utf8("Signature"), s -> s.u2(10))));
        RecordAttribute.RecordComponent component = record.getComponents().get(0);
        assertEquals(8, component.getNameIndex());
        assertEquals(9, component.getDescriptorIndex());
        SignatureAttribute signature = (SignatureAttribute) component.findAttribute(AttributeType.SIGNATURE).get();
        assertEquals(10, signature.getSignatureIndex());
    }

    @Test
    public void testUnknownAttributeName() {
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class,
                () -> parse(attribute("Foo", c -> c.u2(0))));
        assertEquals("attribute_name_index", e.getField());
        assertTrue(e.getMessage(), e.getMessage().endsWith("has unknown name: \"Foo\""));
    }

    @Test
    public void testNameMustBeUtf8() {
        int notUtf8 = b.integer(1);
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class,
                () -> parse(new Bytes().attribute(notUtf8, c -> { })));
        assertTrue(e.getMessage(), e.getMessage().contains("refers to constant pool #1"));

        assertThrows(MalformedClassFileException.class, () -> parse(new Bytes().attribute(0, c -> { })));
    }

    @Test
    public void testFixedLengthMismatch() {
        Bytes bytes = new Bytes().u2(b.utf8("ConstantValue")).u4(3).u2(4).u1(0);
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class, () -> parse(bytes));
        assertEquals("ConstantValue.attribute_length", e.getField());
        assertTrue(e.getMessage(), e.getMessage().endsWith("expected: 0x2, actual: 0x3"));
    }

    @Test
    public void testDeclaredLengthMismatch() {
        Bytes bytes = new Bytes().u2(b.utf8("Exceptions")).u4(6).u2(1).u2(5).u2(0);
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class, () -> parse(bytes));
        assertEquals("Exceptions.attribute_length", e.getField());
        assertTrue(e.getMessage(), e.getMessage().endsWith("declared: 0x6, consumed: 0x4"));
    }

    @Test
    public void testLengthCheckCanBeDisabled() throws Exception {
        Bytes bytes = new Bytes().u2(b.utf8("Exceptions")).u4(100).u2(1).u2(5);
        ParserOptions options = ParserOptions.builder().checkAttributeLength(false).build();
        ClassInput in = bytes.input();
        ExceptionsAttribute attr = (ExceptionsAttribute) new AttributeParser(b.constantPool(), options, 52)
                .readAttribute(in);
        assertEquals(100, attr.getAttributeLength());
        assertEquals(Arrays.asList(5), attr.getExceptionIndexTable());
    }

    @Test
    public void testTruncatedAttribute() {
        Bytes bytes = new Bytes().u2(b.utf8("Code")).u4(12).u2(1).u2(1).u4(10).raw(0xB1);
        assertThrows(EOFException.class, () -> parse(bytes));
    }

    @Test
    public void testReadAttributes() throws Exception {
        Bytes bytes = new Bytes().u2(2)
                .attribute(b.utf8("Synthetic"), c -> { })
                .attribute(b.utf8("Deprecated"), c -> { });
        ClassInput in = bytes.input();
        List<AttributeInfo> attributes =
                new AttributeParser(b.constantPool(), ParserOptions.DEFAULT, 52).readAttributes(in);
        assertEquals(2, attributes.size());
        assertTrue(AttributeInfo.find(attributes, AttributeType.DEPRECATED).isPresent());
        assertFalse(AttributeInfo.find(attributes, AttributeType.CODE).isPresent());
    }
}
