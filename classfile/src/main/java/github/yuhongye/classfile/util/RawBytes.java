package github.yuhongye.classfile.util;

import com.google.common.io.BaseEncoding;

import java.util.Arrays;

/**
 * 不可变的字节序列, 给 byte[] 增加 equals 和 hashcode.
 * 构造时总是拷贝一份, 所以解析结果不会被外部修改
 */
public final class RawBytes {
    public static final RawBytes EMPTY = new RawBytes(new byte[0]);

    private final byte[] data;

    private RawBytes(byte[] data) {
        this.data = data;
    }

    public static RawBytes copyOf(byte[] bytes) {
        return bytes.length == 0 ? EMPTY : new RawBytes(bytes.clone());
    }

    public static RawBytes of(int... unsignedBytes) {
        byte[] bytes = new byte[unsignedBytes.length];
        for (int i = 0; i < unsignedBytes.length; i++) {
            bytes[i] = (byte) unsignedBytes[i];
        }
        return new RawBytes(bytes);
    }

    /**
     * @throws ArrayIndexOutOfBoundsException
     */
    public byte get(int i) {
        return data[i];
    }

    public int getUnsigned(int i) {
        return data[i] & 0xFF;
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(data, ((RawBytes) obj).data);
    }

    @Override
    public String toString() {
        return "RawBytes(size=" + data.length + ", hex=" + BaseEncoding.base16().lowerCase().encode(data) + ")";
    }
}
