package github.yuhongye.classfile.attribute.stackmap;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * StackMapTable 中的一个栈帧, frame_type 决定具体结构, 见 {@link FrameKind}.
 * 每个栈帧描述的字节码偏移量 = 上一个栈帧的偏移量 + offset_delta + 1(第一个栈帧不加 1)
 */
@Getter
@ToString
public abstract class StackMapFrame {
    private final int frameType;

    StackMapFrame(int frameType) {
        this.frameType = frameType;
    }

    public abstract FrameKind getKind();

    /**
     * same_frame 和 same_locals_1_stack_item_frame 的 offset_delta 隐含在 frame_type 中
     */
    public abstract int getOffsetDelta();

    /**
     * frame_type 0-63: 局部变量表和上一帧相同, 操作数栈为空
     */
    @ToString(callSuper = true)
    public static final class SameFrame extends StackMapFrame {
        public SameFrame(int frameType) {
            super(frameType);
        }

        @Override
        public FrameKind getKind() {
            return FrameKind.SAME;
        }

        @Override
        public int getOffsetDelta() {
            return getFrameType();
        }
    }

    /**
     * frame_type 64-127: 局部变量表和上一帧相同, 操作数栈只有一项
     */
    @Getter
    @ToString(callSuper = true)
    public static final class SameLocals1StackItemFrame extends StackMapFrame {
        private final VerificationTypeInfo stack;

        public SameLocals1StackItemFrame(int frameType, VerificationTypeInfo stack) {
            super(frameType);
            this.stack = stack;
        }

        @Override
        public FrameKind getKind() {
            return FrameKind.SAME_LOCALS_1_STACK_ITEM;
        }

        @Override
        public int getOffsetDelta() {
            return getFrameType() - FrameKind.SAME_LOCALS_1_STACK_ITEM.getLower();
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static final class SameLocals1StackItemFrameExtended extends StackMapFrame {
        private final int offsetDelta;
        private final VerificationTypeInfo stack;

        public SameLocals1StackItemFrameExtended(int frameType, int offsetDelta, VerificationTypeInfo stack) {
            super(frameType);
            this.offsetDelta = offsetDelta;
            this.stack = stack;
        }

        @Override
        public FrameKind getKind() {
            return FrameKind.SAME_LOCALS_1_STACK_ITEM_EXTENDED;
        }
    }

    /**
     * frame_type 248-250: 去掉最后 251 - frame_type 个局部变量, 操作数栈为空
     */
    @Getter
    @ToString(callSuper = true)
    public static final class ChopFrame extends StackMapFrame {
        private final int offsetDelta;

        public ChopFrame(int frameType, int offsetDelta) {
            super(frameType);
            this.offsetDelta = offsetDelta;
        }

        public int getChoppedLocals() {
            return FrameKind.SAME_FRAME_EXTENDED.getLower() - getFrameType();
        }

        @Override
        public FrameKind getKind() {
            return FrameKind.CHOP;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static final class SameFrameExtended extends StackMapFrame {
        private final int offsetDelta;

        public SameFrameExtended(int frameType, int offsetDelta) {
            super(frameType);
            this.offsetDelta = offsetDelta;
        }

        @Override
        public FrameKind getKind() {
            return FrameKind.SAME_FRAME_EXTENDED;
        }
    }

    /**
     * frame_type 252-254: 在上一帧的基础上追加 frame_type - 251 个局部变量, 操作数栈为空
     */
    @Getter
    @ToString(callSuper = true)
    public static final class AppendFrame extends StackMapFrame {
        private final int offsetDelta;
        private final ImmutableList<VerificationTypeInfo> locals;

        public AppendFrame(int frameType, int offsetDelta, List<VerificationTypeInfo> locals) {
            super(frameType);
            this.offsetDelta = offsetDelta;
            this.locals = ImmutableList.copyOf(locals);
        }

        @Override
        public FrameKind getKind() {
            return FrameKind.APPEND;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static final class FullFrame extends StackMapFrame {
        private final int offsetDelta;
        private final ImmutableList<VerificationTypeInfo> locals;
        private final ImmutableList<VerificationTypeInfo> stack;

        public FullFrame(int frameType, int offsetDelta, List<VerificationTypeInfo> locals,
                         List<VerificationTypeInfo> stack) {
            super(frameType);
            this.offsetDelta = offsetDelta;
            this.locals = ImmutableList.copyOf(locals);
            this.stack = ImmutableList.copyOf(stack);
        }

        @Override
        public FrameKind getKind() {
            return FrameKind.FULL;
        }
    }
}
