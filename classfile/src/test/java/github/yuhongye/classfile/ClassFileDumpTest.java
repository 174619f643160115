package github.yuhongye.classfile;

import github.yuhongye.classfile.ClassFileBuilder.Bytes;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;

public class ClassFileDumpTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDump() throws Exception {
        ClassFileBuilder b = new ClassFileBuilder();
        int thisClass = b.classRef("demo/Empty");
        int superClass = b.classRef("java/lang/Object");
        int name = b.utf8("<init>");
        int desc = b.utf8("()V");
        Bytes body = ClassFileBuilder.header(0x0021, thisClass, superClass)
                .u2(0)
                .u2(1).u2(0x0001).u2(name).u2(desc).u2(0)
                .u2(0);
        Path path = folder.newFile("Empty.class").toPath();
        Files.write(path, b.build(body));

        ClassFile classFile = ClassFileDump.dump(path);
        assertEquals("demo/Empty", classFile.getThisClassName());
        assertEquals("<init>", classFile.getMethods().get(0).getName(classFile.getConstantPool()));
    }

    @Test
    public void testMainWithoutArguments() throws Exception {
        ClassFileDump.main(new String[0]);
    }
}
