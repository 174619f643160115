package github.yuhongye.classfile.parser;

import github.yuhongye.classfile.attribute.annotation.Annotation;
import github.yuhongye.classfile.attribute.annotation.ElementValue;
import github.yuhongye.classfile.attribute.annotation.ElementValuePair;
import github.yuhongye.classfile.attribute.annotation.ElementValueTag;
import github.yuhongye.classfile.attribute.annotation.TargetInfo;
import github.yuhongye.classfile.attribute.annotation.TargetKind;
import github.yuhongye.classfile.attribute.annotation.TypeAnnotation;
import github.yuhongye.classfile.attribute.annotation.TypePathEntry;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 解析 annotation, element_value 以及 type_annotation, 供四类注解属性和 AnnotationDefault 使用
 */
@Slf4j
public final class AnnotationParser {
    /** element_value 中数组和 annotation 的嵌套层数上限 */
    static final int MAX_NESTING_DEPTH = 256;

    @FunctionalInterface
    interface TargetReader {
        TargetInfo read(ClassInput in) throws IOException;
    }

    private static final Map<TargetKind, TargetReader> targetKindParser = new EnumMap<>(TargetKind.class);
    static {
        targetKindParser.put(TargetKind.TYPE_PARAMETER,       in -> new TargetInfo.TypeParameterTarget(in.u1()));
        targetKindParser.put(TargetKind.SUPERTYPE,            in -> new TargetInfo.SupertypeTarget(in.u2()));
        targetKindParser.put(TargetKind.TYPE_PARAMETER_BOUND, in -> new TargetInfo.TypeParameterBoundTarget(in.u1(), in.u1()));
        targetKindParser.put(TargetKind.EMPTY,                in -> TargetInfo.EmptyTarget.INSTANCE);
        targetKindParser.put(TargetKind.FORMAL_PARAMETER,     in -> new TargetInfo.FormalParameterTarget(in.u1()));
        targetKindParser.put(TargetKind.THROWS,               in -> new TargetInfo.ThrowsTarget(in.u2()));
        targetKindParser.put(TargetKind.LOCALVAR,             AnnotationParser::readLocalVarTarget);
        targetKindParser.put(TargetKind.CATCH,                in -> new TargetInfo.CatchTarget(in.u2()));
        targetKindParser.put(TargetKind.OFFSET,               in -> new TargetInfo.OffsetTarget(in.u2()));
        targetKindParser.put(TargetKind.TYPE_ARGUMENT,        in -> new TargetInfo.TypeArgumentTarget(in.u2(), in.u1()));
    }

    private AnnotationParser() { }

    public static List<Annotation> readAnnotations(ClassInput in) throws IOException {
        int numAnnotations = in.u2();
        List<Annotation> annotations = new ArrayList<>(numAnnotations);
        for (int i = 0; i < numAnnotations; i++) {
            annotations.add(readAnnotation(in));
        }
        return annotations;
    }

    public static Annotation readAnnotation(ClassInput in) throws IOException {
        return readAnnotation(in, 0);
    }

    public static ElementValue readElementValue(ClassInput in) throws IOException {
        return readElementValue(in, 0);
    }

    private static Annotation readAnnotation(ClassInput in, int depth) throws IOException {
        int typeIndex = in.u2();
        return new Annotation(typeIndex, readElementValuePairs(in, depth));
    }

    /**
     * @param depth 外层 annotation 和数组的嵌套层数, 超过 {@link #MAX_NESTING_DEPTH} 报错
     */
    private static ElementValue readElementValue(ClassInput in, int depth) throws IOException {
        if (depth > MAX_NESTING_DEPTH) {
            throw new MalformedClassFileException(in.getSubject(), "element_value",
                    "nesting too deep at byte " + in.position() + ", limit is " + MAX_NESTING_DEPTH);
        }
        int tag = in.u1();
        ElementValueTag evTag = ElementValueTag.getByTag(tag);
        if (evTag == null) {
            throw MalformedClassFileException.notOneOf(in.getSubject(), "element_value.tag",
                    tag, ElementValueTag.allTags());
        }
        if (evTag.isConstant()) {
            return new ElementValue.ConstValue(evTag, in.u2());
        }
        switch (evTag) {
            case ENUM:
                return new ElementValue.EnumConstValue(in.u2(), in.u2());
            case CLASS:
                return new ElementValue.ClassValue(in.u2());
            case ANNOTATION:
                return new ElementValue.AnnotationValue(readAnnotation(in, depth));
            case ARRAY:
                int numValues = in.u2();
                List<ElementValue> values = new ArrayList<>(numValues);
                for (int i = 0; i < numValues; i++) {
                    values.add(readElementValue(in, depth + 1));
                }
                return new ElementValue.ArrayValue(values);
            default:
                throw new IllegalStateException("Unhandled element_value tag: " + evTag);
        }
    }

    public static List<TypeAnnotation> readTypeAnnotations(ClassInput in) throws IOException {
        int numAnnotations = in.u2();
        List<TypeAnnotation> annotations = new ArrayList<>(numAnnotations);
        for (int i = 0; i < numAnnotations; i++) {
            annotations.add(readTypeAnnotation(in));
        }
        return annotations;
    }

    public static TypeAnnotation readTypeAnnotation(ClassInput in) throws IOException {
        int targetType = in.u1();
        TargetKind kind = TargetKind.getByTargetType(targetType);
        if (kind == null) {
            throw MalformedClassFileException.notOneOf(in.getSubject(), "type_annotation.target_type",
                    targetType, TargetKind.allTargetTypes());
        }
        TargetInfo targetInfo = targetKindParser.get(kind).read(in);
        log.debug("Read type annotation target 0x{}: {}", Integer.toHexString(targetType), targetInfo);
        List<TypePathEntry> targetPath = readTypePath(in);
        int typeIndex = in.u2();
        return new TypeAnnotation(targetType, targetInfo, targetPath, typeIndex, readElementValuePairs(in, 0));
    }

    private static List<ElementValuePair> readElementValuePairs(ClassInput in, int depth) throws IOException {
        int numPairs = in.u2();
        List<ElementValuePair> pairs = new ArrayList<>(numPairs);
        for (int i = 0; i < numPairs; i++) {
            int elementNameIndex = in.u2();
            pairs.add(new ElementValuePair(elementNameIndex, readElementValue(in, depth + 1)));
        }
        return pairs;
    }

    /**
     * localvar_target {
     *     u2 table_length;
     *     {   u2 start_pc;
     *         u2 length;
     *         u2 index;
     *     } table[table_length];
     * }
     */
    private static TargetInfo readLocalVarTarget(ClassInput in) throws IOException {
        int tableLength = in.u2();
        List<TargetInfo.LocalVarTargetEntry> table = new ArrayList<>(tableLength);
        for (int i = 0; i < tableLength; i++) {
            table.add(new TargetInfo.LocalVarTargetEntry(in.u2(), in.u2(), in.u2()));
        }
        return new TargetInfo.LocalVarTarget(table);
    }

    /**
     * type_path {
     *     u1 path_length;
     *     {   u1 type_path_kind;
     *         u1 type_argument_index;
     *     } path[path_length];
     * }
     */
    private static List<TypePathEntry> readTypePath(ClassInput in) throws IOException {
        int pathLength = in.u1();
        List<TypePathEntry> path = new ArrayList<>(pathLength);
        for (int i = 0; i < pathLength; i++) {
            path.add(new TypePathEntry(in.u1(), in.u1()));
        }
        return path;
    }
}
