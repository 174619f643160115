package github.yuhongye.classfile.attribute.annotation;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 类型注解作用的位置
 */
public abstract class TargetInfo {

    TargetInfo() { }

    public abstract TargetKind getKind();

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class TypeParameterTarget extends TargetInfo {
        private final int typeParameterIndex;

        @Override
        public TargetKind getKind() {
            return TargetKind.TYPE_PARAMETER;
        }
    }

    /**
     * supertypeIndex 为 65535 表示 extends 子句, 否则是 interfaces 数组的下标
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class SupertypeTarget extends TargetInfo {
        private final int supertypeIndex;

        @Override
        public TargetKind getKind() {
            return TargetKind.SUPERTYPE;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class TypeParameterBoundTarget extends TargetInfo {
        private final int typeParameterIndex;
        private final int boundIndex;

        @Override
        public TargetKind getKind() {
            return TargetKind.TYPE_PARAMETER_BOUND;
        }
    }

    @ToString
    public static final class EmptyTarget extends TargetInfo {
        public static final EmptyTarget INSTANCE = new EmptyTarget();

        private EmptyTarget() { }

        @Override
        public TargetKind getKind() {
            return TargetKind.EMPTY;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class FormalParameterTarget extends TargetInfo {
        private final int formalParameterIndex;

        @Override
        public TargetKind getKind() {
            return TargetKind.FORMAL_PARAMETER;
        }
    }

    /**
     * throwsTypeIndex 是 Exceptions 属性中 exception_index_table 的下标
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class ThrowsTarget extends TargetInfo {
        private final int throwsTypeIndex;

        @Override
        public TargetKind getKind() {
            return TargetKind.THROWS;
        }
    }

    @Getter
    @ToString
    public static final class LocalVarTarget extends TargetInfo {
        private final ImmutableList<LocalVarTargetEntry> table;

        public LocalVarTarget(List<LocalVarTargetEntry> table) {
            this.table = ImmutableList.copyOf(table);
        }

        @Override
        public TargetKind getKind() {
            return TargetKind.LOCALVAR;
        }
    }

    /**
     * 局部变量在 [startPc, startPc + length) 区间内位于第 index 个槽位
     */
    @AllArgsConstructor
    @Getter
    @ToString
    public static final class LocalVarTargetEntry {
        private final int startPc;
        private final int length;
        private final int index;
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class CatchTarget extends TargetInfo {
        private final int exceptionTableIndex;

        @Override
        public TargetKind getKind() {
            return TargetKind.CATCH;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class OffsetTarget extends TargetInfo {
        private final int offset;

        @Override
        public TargetKind getKind() {
            return TargetKind.OFFSET;
        }
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static final class TypeArgumentTarget extends TargetInfo {
        private final int offset;
        private final int typeArgumentIndex;

        @Override
        public TargetKind getKind() {
            return TargetKind.TYPE_ARGUMENT;
        }
    }
}
