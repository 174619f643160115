package github.yuhongye.classfile.util;

import github.yuhongye.classfile.exceptions.MalformedModifiedUtf8Exception;

/**
 * CONSTANT_Utf8_info 使用的 modified UTF-8 解码, 和标准 UTF-8 的区别:
 * 1. 0 不会以单字节出现, 而是编码成两字节 0xC0 0x80
 * 2. 不使用四字节格式, 辅助平面字符先拆成 UTF-16 代理对, 每个代理分别按三字节格式编码, 共六个字节
 *
 * 六字节格式:
 * u1 0xED;
 * u1 1010xxxx;  // (codepoint - 0x10000) 的 bit 16-19
 * u1 10xxxxxx;  // bit 10-15
 * u1 0xED;
 * u1 1011xxxx;  // bit 6-9
 * u1 10xxxxxx;  // bit 0-5
 */
public final class ModifiedUtf8 {
    private static final int SURROGATE_MARKER = 0xED;

    private ModifiedUtf8() { }

    public static String decode(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length);
        int i = 0;
        while (i < bytes.length) {
            int b1 = bytes[i] & 0xFF;
            if (b1 == 0 || b1 >= 0xF0 || (b1 & 0xC0) == 0x80) {
                throw MalformedModifiedUtf8Exception.invalidLeadingByte(i, b1);
            }

            if (b1 <= 0x7F) {
                sb.append((char) b1);
                i += 1;
            } else if ((b1 & 0xE0) == 0xC0) {
                requireRemaining(bytes, i, 1);
                int b2 = continuation(bytes, i + 1);
                sb.append((char) (((b1 & 0x1F) << 6) | (b2 & 0x3F)));
                i += 2;
            } else if (isSupplementary(bytes, i)) {
                int b2 = bytes[i + 1] & 0xFF;
                int b3 = continuation(bytes, i + 2);
                int b4 = bytes[i + 3] & 0xFF;
                if (b4 != SURROGATE_MARKER) {
                    throw new MalformedModifiedUtf8Exception(i + 3, "byte " + hex(b4)
                            + " must be 0xed in a six-byte sequence");
                }
                int b5 = bytes[i + 4] & 0xFF;
                if ((b5 & 0xF0) != 0xB0) {
                    throw new MalformedModifiedUtf8Exception(i + 4, "byte " + hex(b5)
                            + " does not encode a low surrogate (1011xxxx)");
                }
                int b6 = continuation(bytes, i + 5);
                int codepoint = 0x10000 + ((b2 & 0x0F) << 16) + ((b3 & 0x3F) << 10)
                        + ((b5 & 0x0F) << 6) + (b6 & 0x3F);
                if (!Character.isValidCodePoint(codepoint)) {
                    throw MalformedModifiedUtf8Exception.invalidCodepoint(i, codepoint);
                }
                sb.appendCodePoint(codepoint);
                i += 6;
            } else {
                requireRemaining(bytes, i, 2);
                int b2 = continuation(bytes, i + 1);
                int b3 = continuation(bytes, i + 2);
                int codepoint = ((b1 & 0x0F) << 12) | ((b2 & 0x3F) << 6) | (b3 & 0x3F);
                if (Character.isSurrogate((char) codepoint)) {
                    // 落单的代理, 不是合法的 Unicode 标量
                    throw MalformedModifiedUtf8Exception.invalidCodepoint(i, codepoint);
                }
                sb.append((char) codepoint);
                i += 3;
            }
        }
        return sb.toString();
    }

    /**
     * 0xED 1010xxxx 开头的是高代理, 只能以六字节格式出现.
     * 剩余不足六个字节时按三字节处理, 报告为落单的代理
     */
    private static boolean isSupplementary(byte[] bytes, int i) {
        return (bytes[i] & 0xFF) == SURROGATE_MARKER
                && i + 5 < bytes.length
                && (bytes[i + 1] & 0xF0) == 0xA0;
    }

    private static void requireRemaining(byte[] bytes, int offset, int expected) {
        int remaining = bytes.length - offset - 1;
        if (remaining < expected) {
            int[] present = new int[remaining + 1];
            for (int k = 0; k < present.length; k++) {
                present[k] = bytes[offset + k] & 0xFF;
            }
            throw MalformedModifiedUtf8Exception.truncated(offset, expected, remaining, present);
        }
    }

    private static int continuation(byte[] bytes, int offset) {
        int b = bytes[offset] & 0xFF;
        if ((b & 0xC0) != 0x80) {
            throw MalformedModifiedUtf8Exception.badContinuation(offset, b);
        }
        return b;
    }

    private static String hex(int value) {
        return "0x" + Integer.toHexString(value);
    }
}
