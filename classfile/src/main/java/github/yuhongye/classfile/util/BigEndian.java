package github.yuhongye.classfile.util;

/**
 * class 文件中的多字节数值都是大端序
 */
public final class BigEndian {
    private BigEndian() { }

    public static int readInt(RawBytes data) {
        return readInt(data, 0);
    }

    public static int readInt(RawBytes data, int offset) {
        int value = data.getUnsigned(offset) << 24;
        value |= data.getUnsigned(offset + 1) << 16;
        value |= data.getUnsigned(offset + 2) << 8;
        value |= data.getUnsigned(offset + 3);
        return value;
    }

    /**
     * CONSTANT_Long_info 和 CONSTANT_Double_info 把 8 个字节拆成 high_bytes 和 low_bytes 两个 u4
     */
    public static long combine(long highBytes, long lowBytes) {
        return ((highBytes & 0xFFFFFFFFL) << 32) | (lowBytes & 0xFFFFFFFFL);
    }
}
