package github.yuhongye.classfile.parser;

import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import com.google.common.io.CountingInputStream;
import github.yuhongye.classfile.util.RawBytes;
import lombok.Getter;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * 顺序读取 class 文件内容, 所有多字节数值都按大端序的无符号数读取.
 * 只能向前读, 记录已经消费的字节数; 输入不足时抛出 {@link EOFException}
 */
public class ClassInput {
    /** 一次性分配的上限, 更长的字节序列边读边扩容, 避免被伪造的长度字段撑爆内存 */
    private static final int EAGER_ALLOCATION_LIMIT = 64 * 1024;

    /**
     * 出错时用来标识是哪个文件
     */
    @Getter
    private final String subject;
    private final CountingInputStream counter;
    private final DataInputStream in;

    public ClassInput(InputStream source, String subject) {
        this.subject = subject;
        this.counter = new CountingInputStream(source);
        this.in = new DataInputStream(counter);
    }

    /**
     * @return 已经消费的字节数
     */
    public long position() {
        return counter.getCount();
    }

    public int u1() throws IOException {
        long start = position();
        int b = in.read();
        if (b < 0) {
            throw exhausted(start, 1);
        }
        return b;
    }

    public int u2() throws IOException {
        long start = position();
        try {
            return in.readUnsignedShort();
        } catch (EOFException e) {
            throw exhausted(start, 2);
        }
    }

    public long u4() throws IOException {
        long start = position();
        try {
            return in.readInt() & 0xFFFFFFFFL;
        } catch (EOFException e) {
            throw exhausted(start, 4);
        }
    }

    public RawBytes bytes(long length) throws IOException {
        Preconditions.checkArgument(length >= 0, "length must not be negative: %s", length);
        long start = position();
        if (length <= EAGER_ALLOCATION_LIMIT) {
            byte[] data = new byte[(int) length];
            try {
                in.readFully(data);
            } catch (EOFException e) {
                throw exhausted(start, length);
            }
            return RawBytes.copyOf(data);
        }

        byte[] data = ByteStreams.toByteArray(ByteStreams.limit(in, length));
        if (data.length != length) {
            throw exhausted(start, length);
        }
        return RawBytes.copyOf(data);
    }

    /**
     * 读到末尾时返回 true, 否则会消费掉一个字节
     */
    public boolean isAtEnd() throws IOException {
        return in.read() < 0;
    }

    private EOFException exhausted(long start, long needed) {
        return new EOFException(subject + ": unexpected end of input at byte " + start
                + ", " + needed + " byte(s) needed but only " + (position() - start) + " left");
    }
}
