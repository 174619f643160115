package github.yuhongye.classfile.attribute.stackmap;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * stack_map_frame 按 frame_type 的取值范围区分, 128-246 保留未用
 */
@AllArgsConstructor
@Getter
public enum FrameKind {
    SAME(                              0,  63),
    SAME_LOCALS_1_STACK_ITEM(         64, 127),
    SAME_LOCALS_1_STACK_ITEM_EXTENDED(247, 247),
    CHOP(                            248, 250),
    SAME_FRAME_EXTENDED(             251, 251),
    APPEND(                          252, 254),
    FULL(                            255, 255),
    ;

    private int lower;
    private int upper;

    public boolean contains(int frameType) {
        return frameType >= lower && frameType <= upper;
    }

    /**
     * @return frame_type 对应的类型, 保留值返回 null
     */
    public static FrameKind getByFrameType(int frameType) {
        for (FrameKind kind : values()) {
            if (kind.contains(frameType)) {
                return kind;
            }
        }
        return null;
    }
}
