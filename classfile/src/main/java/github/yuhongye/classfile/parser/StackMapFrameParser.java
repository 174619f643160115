package github.yuhongye.classfile.parser;

import github.yuhongye.classfile.attribute.stackmap.FrameKind;
import github.yuhongye.classfile.attribute.stackmap.StackMapFrame;
import github.yuhongye.classfile.attribute.stackmap.VerificationType;
import github.yuhongye.classfile.attribute.stackmap.VerificationTypeInfo;
import github.yuhongye.classfile.exceptions.MalformedClassFileException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static github.yuhongye.classfile.exceptions.MalformedClassFileException.hex;

/**
 * 解析 StackMapTable 中的 stack_map_frame, frame_type 决定后面的结构
 */
@Slf4j
public final class StackMapFrameParser {

    @FunctionalInterface
    interface FrameReader {
        StackMapFrame read(ClassInput in, int frameType) throws IOException;
    }

    private static final Map<FrameKind, FrameReader> frameKindParser = new EnumMap<>(FrameKind.class);
    static {
        frameKindParser.put(FrameKind.SAME,
                (in, frameType) -> new StackMapFrame.SameFrame(frameType));
        frameKindParser.put(FrameKind.SAME_LOCALS_1_STACK_ITEM,
                (in, frameType) -> new StackMapFrame.SameLocals1StackItemFrame(frameType, readVerificationType(in)));
        frameKindParser.put(FrameKind.SAME_LOCALS_1_STACK_ITEM_EXTENDED,
                (in, frameType) -> new StackMapFrame.SameLocals1StackItemFrameExtended(frameType, in.u2(), readVerificationType(in)));
        frameKindParser.put(FrameKind.CHOP,
                (in, frameType) -> new StackMapFrame.ChopFrame(frameType, in.u2()));
        frameKindParser.put(FrameKind.SAME_FRAME_EXTENDED,
                (in, frameType) -> new StackMapFrame.SameFrameExtended(frameType, in.u2()));
        frameKindParser.put(FrameKind.APPEND,
                StackMapFrameParser::readAppendFrame);
        frameKindParser.put(FrameKind.FULL,
                StackMapFrameParser::readFullFrame);
    }

    private StackMapFrameParser() { }

    public static StackMapFrame readFrame(ClassInput in) throws IOException {
        int frameType = in.u1();
        FrameKind kind = FrameKind.getByFrameType(frameType);
        if (kind == null) {
            throw new MalformedClassFileException(in.getSubject(), "stack_map_frame.frame_type",
                    "has reserved value, expected one of: [" + hex(FrameKind.SAME.getLower()) + "-"
                            + hex(FrameKind.SAME_LOCALS_1_STACK_ITEM.getUpper()) + ", "
                            + hex(FrameKind.SAME_LOCALS_1_STACK_ITEM_EXTENDED.getLower()) + "-"
                            + hex(FrameKind.FULL.getUpper()) + "], actual: " + hex(frameType));
        }
        StackMapFrame frame = frameKindParser.get(kind).read(in, frameType);
        log.debug("Read stack map frame {}: {}", kind, frame);
        return frame;
    }

    public static VerificationTypeInfo readVerificationType(ClassInput in) throws IOException {
        int tag = in.u1();
        VerificationType type = VerificationType.getByTag(tag);
        if (type == null) {
            throw MalformedClassFileException.notOneOf(in.getSubject(), "verification_type_info.tag",
                    tag, VerificationType.allTags());
        }
        switch (type) {
            case OBJECT:
                return new VerificationTypeInfo.ObjectVariable(in.u2());
            case UNINITIALIZED:
                return new VerificationTypeInfo.UninitializedVariable(in.u2());
            default:
                return VerificationTypeInfo.of(type);
        }
    }

    /**
     * frame_type - 251 个新增的局部变量
     */
    private static StackMapFrame readAppendFrame(ClassInput in, int frameType) throws IOException {
        int offsetDelta = in.u2();
        List<VerificationTypeInfo> locals = readVerificationTypes(in, frameType - 251);
        return new StackMapFrame.AppendFrame(frameType, offsetDelta, locals);
    }

    /**
     * full_frame {
     *     u1 frame_type = FULL_FRAME; // 255
     *     u2 offset_delta;
     *     u2 number_of_locals;
     *     verification_type_info locals[number_of_locals];
     *     u2 number_of_stack_items;
     *     verification_type_info stack[number_of_stack_items];
     * }
     */
    private static StackMapFrame readFullFrame(ClassInput in, int frameType) throws IOException {
        int offsetDelta = in.u2();
        List<VerificationTypeInfo> locals = readVerificationTypes(in, in.u2());
        List<VerificationTypeInfo> stack = readVerificationTypes(in, in.u2());
        return new StackMapFrame.FullFrame(frameType, offsetDelta, locals, stack);
    }

    private static List<VerificationTypeInfo> readVerificationTypes(ClassInput in, int count) throws IOException {
        List<VerificationTypeInfo> types = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            types.add(readVerificationType(in));
        }
        return types;
    }
}
