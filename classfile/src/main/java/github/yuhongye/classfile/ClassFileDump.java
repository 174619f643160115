package github.yuhongye.classfile;

import github.yuhongye.classfile.parser.ClassParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 解析命令行指定的 class 文件并把结果输出到日志
 */
@Slf4j
public class ClassFileDump {

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            log.error("Usage: ClassFileDump <path-to-class-file>");
            return;
        }
        dump(Paths.get(args[0]));
    }

    public static ClassFile dump(Path path) throws IOException {
        ClassFile classFile = new ClassParser().parse(path);
        log.info("{} {} extends {}, JDK version: {}", classFile.getAccessDescription(), classFile.getThisClassName(),
                classFile.getSuperClassName(), classFile.getJdkVersion().map(Object::toString).orElse("unknown"));
        log.info("{}", classFile.getConstantPool());
        for (FieldInfo field : classFile.getFields()) {
            log.info("Field {} {} {}", field.getAccessDescription(),
                    field.getName(classFile.getConstantPool()), field.getDescriptor(classFile.getConstantPool()));
        }
        for (MethodInfo method : classFile.getMethods()) {
            log.info("Method {} {} {}", method.getAccessDescription(),
                    method.getName(classFile.getConstantPool()), method.getDescriptor(classFile.getConstantPool()));
        }
        log.info("{} file: {}", path, classFile);
        return classFile;
    }
}
