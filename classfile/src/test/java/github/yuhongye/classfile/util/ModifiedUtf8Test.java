package github.yuhongye.classfile.util;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import github.yuhongye.classfile.exceptions.MalformedModifiedUtf8Exception;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ModifiedUtf8Test {

    private static byte[] bytes(int... unsigned) {
        return RawBytes.of(unsigned).toByteArray();
    }

    private static MalformedModifiedUtf8Exception decodeFails(int... unsigned) {
        return assertThrows(MalformedModifiedUtf8Exception.class, () -> ModifiedUtf8.decode(bytes(unsigned)));
    }

    @Test
    public void testAscii() {
        assertEquals("A", ModifiedUtf8.decode(bytes(0x41)));
        assertEquals("java/lang/Object", ModifiedUtf8.decode("java/lang/Object".getBytes()));
        assertEquals("", ModifiedUtf8.decode(new byte[0]));
    }

    @Test
    public void testZeroByteIsRejected() {
        MalformedModifiedUtf8Exception e = decodeFails(0x00);
        assertEquals(0, e.getOffset());
        assertTrue(e.getMessage(), e.getMessage().contains("0x0 can not start a character"));

        e = decodeFails(0x41, 0x42, 0x00);
        assertEquals(2, e.getOffset());
    }

    @Test
    public void testTwoByteNul() {
        String s = ModifiedUtf8.decode(bytes(0xC0, 0x80));
        assertEquals(1, s.length());
        assertEquals('\u0000', s.charAt(0));
    }

    @Test
    public void testTwoAndThreeByteForms() {
        assertEquals("é", ModifiedUtf8.decode(bytes(0xC3, 0xA9)));
        assertEquals("€", ModifiedUtf8.decode(bytes(0xE2, 0x82, 0xAC)));
        assertEquals("A€é", ModifiedUtf8.decode(bytes(0x41, 0xE2, 0x82, 0xAC, 0xC3, 0xA9)));
    }

    @Test
    public void testSixByteSupplementary() {
        String s = ModifiedUtf8.decode(bytes(0xED, 0xA0, 0xBD, 0xED, 0xB8, 0x80));
        assertEquals(1, s.codePointCount(0, s.length()));
        assertEquals(0x1F600, s.codePointAt(0));
        assertTrue(s.codePointAt(0) >= 0x10000);
    }

    @Test
    public void testAgreesWithWriteUtf() {
        for (String s : Arrays.asList("HelloWorld", "\u0000", "常量池", "a\uD83D\uDE00b", "\uD800\uDC00\uDBFF\uDFFF")) {
            ByteArrayDataOutput out = ByteStreams.newDataOutput();
            out.writeUTF(s);
            byte[] encoded = out.toByteArray();
            assertEquals(s, ModifiedUtf8.decode(Arrays.copyOfRange(encoded, 2, encoded.length)));
        }
    }

    @Test
    public void testInvalidLeadingByte() {
        assertTrue(decodeFails(0xF0).getMessage().contains("0xf0"));
        assertTrue(decodeFails(0xFF).getMessage().contains("0xff"));
        MalformedModifiedUtf8Exception e = decodeFails(0x41, 0x80);
        assertEquals(1, e.getOffset());
    }

    @Test
    public void testTruncated() {
        MalformedModifiedUtf8Exception e = decodeFails(0xC3);
        assertEquals(0, e.getOffset());
        assertTrue(e.getMessage(), e.getMessage().contains("expects 1 more byte(s), but only 0 left"));

        e = decodeFails(0x41, 0xE2, 0x82);
        assertEquals(1, e.getOffset());
        assertEquals("Malformed modified UTF-8 at byte 1: sequence starting with 0xe2 0x82 "
                + "expects 2 more byte(s), but only 1 left", e.getMessage());

        e = decodeFails(0xED, 0xA0);
        assertEquals(0, e.getOffset());
        assertTrue(e.getMessage(), e.getMessage().contains("expects 2 more byte(s), but only 1 left"));
    }

    @Test
    public void testBadContinuation() {
        MalformedModifiedUtf8Exception e = decodeFails(0xC3, 0x41);
        assertEquals(1, e.getOffset());
        assertTrue(e.getMessage().contains("0x41 is not a continuation byte"));

        e = decodeFails(0xE2, 0x82, 0xC0);
        assertEquals(2, e.getOffset());
    }

    @Test
    public void testSixByteFormChecksMarkerBytes() {
        MalformedModifiedUtf8Exception e = decodeFails(0xED, 0xA0, 0xBD, 0x41, 0xB8, 0x80);
        assertEquals(3, e.getOffset());
        assertTrue(e.getMessage().contains("must be 0xed"));

        e = decodeFails(0xED, 0xA0, 0xBD, 0xED, 0xA8, 0x80);
        assertEquals(4, e.getOffset());
    }

    @Test
    public void testLoneLowSurrogate() {
        MalformedModifiedUtf8Exception e = decodeFails(0xED, 0xB0, 0x80);
        assertEquals(0, e.getOffset());
        assertTrue(e.getMessage(), e.getMessage().contains("invalid codepoint 0xdc00"));
    }

    @Test
    public void testLoneHighSurrogate() {
        MalformedModifiedUtf8Exception e = decodeFails(0xED, 0xA0, 0x80);
        assertEquals(0, e.getOffset());
        assertTrue(e.getMessage(), e.getMessage().contains("invalid codepoint 0xd800"));

        e = decodeFails(0x41, 0xED, 0xA0, 0xBD, 0xED, 0xB8);
        assertEquals(1, e.getOffset());
        assertTrue(e.getMessage(), e.getMessage().contains("invalid codepoint 0xd83d"));
    }
}
