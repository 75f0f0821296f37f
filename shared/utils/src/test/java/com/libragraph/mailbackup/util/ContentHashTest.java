package com.libragraph.mailbackup.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    private static final String HEX =
            "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

    @Test
    void shouldConstructFromValidBytes() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0xAB;
        bytes[31] = (byte) 0xCD;

        ContentHash hash = new ContentHash(bytes);
        assertThat(hash.bytes()).hasSize(32);
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0xAB);
    }

    @Test
    void shouldDefensiveCopyOnConstruction() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0x01;
        ContentHash hash = new ContentHash(bytes);

        bytes[0] = (byte) 0xFF;
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldNotExposeInternalArray() {
        ContentHash hash = ContentHash.fromHex(HEX);

        hash.bytes()[0] = (byte) 0xFF;
        assertThat(hash.toHex()).isEqualTo(HEX);
    }

    @Test
    void shouldRejectNullBytes() {
        assertThatNullPointerException()
                .isThrownBy(() -> new ContentHash(null));
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentHash(new byte[16]))
                .withMessageContaining("32 bytes");
    }

    @Test
    void shouldRoundTripHex() {
        assertThat(ContentHash.fromHex(HEX).toHex()).isEqualTo(HEX);
    }

    @Test
    void shouldRejectInvalidHexLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("abcd"))
                .withMessageContaining("64 characters");
    }

    @Test
    void shouldRejectInvalidHexCharacters() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("z".repeat(64)));
    }

    @Test
    void shouldHashIdenticalContentToSameDigest() {
        byte[] a = "Subject: quarterly report".getBytes(StandardCharsets.UTF_8);
        byte[] b = "Subject: quarterly report".getBytes(StandardCharsets.UTF_8);

        assertThat(ContentHash.of(a)).isEqualTo(ContentHash.of(b));
    }

    @Test
    void shouldHashDifferentContentToDifferentDigests() {
        ContentHash a = ContentHash.of("one".getBytes(StandardCharsets.UTF_8));
        ContentHash b = ContentHash.of("two".getBytes(StandardCharsets.UTF_8));

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void shouldMatchKnownBlake3VectorForEmptyInput() {
        assertThat(ContentHash.of(new byte[0]).toHex())
                .isEqualTo("af1349b9f5f9a1a6a0404dea36dcc9499bcb25c9adc112b7cc9a93cae41f3262");
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        ContentHash a = ContentHash.fromHex(HEX);
        ContentHash b = ContentHash.fromHex(HEX);
        ContentHash c = ContentHash.fromHex("f".repeat(64));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    void shouldReturnHexFromToString() {
        assertThat(ContentHash.fromHex(HEX).toString()).isEqualTo(HEX);
    }
}
