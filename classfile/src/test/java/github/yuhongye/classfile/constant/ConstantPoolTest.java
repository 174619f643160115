package github.yuhongye.classfile.constant;

import github.yuhongye.classfile.ClassFileBuilder;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ConstantPoolTest {
    private ConstantPool pool;
    private int utf8;
    private int lng;
    private int cls;

    @Before
    public void setUp() throws Exception {
        ClassFileBuilder b = new ClassFileBuilder();
        utf8 = b.utf8("A");
        lng = b.longValue(7);
        cls = b.classRef("demo/X");
        pool = b.constantPool();
    }

    @Test
    public void testResolve() {
        assertEquals(6, pool.size());
        assertEquals("A", pool.getUtf8(utf8, "name_index"));
        assertEquals("demo/X", pool.getClassName(cls, "this_class"));
        assertEquals(ConstantTag.CONSTANT_LONG_INFO, pool.get(lng, "test").getTag());
    }

    @Test
    public void testOutOfRange() {
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class, () -> pool.get(0, "super_class"));
        assertEquals("super_class", e.getField());
        assertEquals("Malformed class file Fixture.class: super_class refers to constant pool #0: "
                + "index out of range [1, 5]", e.getMessage());

        assertThrows(MalformedClassFileException.class, () -> pool.get(6, "test"));
    }

    @Test
    public void testPlaceholder() {
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class,
                () -> pool.get(lng + 1, "constantvalue_index"));
        assertTrue(e.getMessage(), e.getMessage().contains("unusable"));
    }

    @Test
    public void testWrongVariant() {
        MalformedClassFileException e = assertThrows(MalformedClassFileException.class,
                () -> pool.getUtf8(lng, "attribute_name_index"));
        assertTrue(e.getMessage(), e.getMessage().endsWith("expected Utf8Info, actual Long"));

        e = assertThrows(MalformedClassFileException.class, () -> pool.getClassName(utf8, "this_class"));
        assertEquals("this_class", e.getField());
    }

    @Test
    public void testToString() {
        String dump = pool.toString();
        assertTrue(dump, dump.contains("#1 = Utf8"));
        assertTrue(dump, dump.contains("#2 = Long"));
        assertTrue(dump, !dump.contains("#3 ="));
    }
}
