package works.splice;

import java.util.Optional;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.splice.Sources.raw;

class RawSourceTest {

	@Test
	void text_sizeIsUtf8Length() {
		RawSource source = raw("héllo");
		assertEquals(6, source.size());
		assertArrayEquals("héllo".getBytes(UTF_8), source.buffer());
		assertFalse(source.isBinary());
	}

	@Test
	void binary_bufferIsTheBytes() {
		byte[] bytes = new byte[256];
		RawSource source = raw(bytes);
		assertTrue(source.isBinary());
		assertEquals(256, source.size());
		assertArrayEquals(bytes, source.buffer());
	}

	@Test
	void binary_invalidUtf8_survives() {
		RawSource source = raw(new byte[]{(byte) 128});
		assertEquals("\uFFFD", source.text());
		assertArrayEquals(new byte[]{(byte) 128}, source.buffer());
		assertEquals(1, source.size());
	}

	@Test
	void binary_isCopiedBothWays() {
		byte[] bytes = {1, 2, 3};
		RawSource source = raw(bytes);
		bytes[0] = 9;
		source.buffer()[1] = 9;
		assertArrayEquals(new byte[]{1, 2, 3}, source.buffer());
	}

	@Test
	void binary_hasNoMap() {
		assertEquals(Optional.empty(), raw(new byte[]{'a', '\n'}).map(MapOptions.DEFAULT));
	}

	@Test
	void equalityAndFingerprint() {
		assertEquals(raw("a"), raw("a"));
		assertEquals(raw(new byte[]{'a'}), raw(new byte[]{'a'}));
		assertEquals(raw(new byte[]{'a'}).hashCode(), raw(new byte[]{'a'}).hashCode());
		assertNotEquals(raw("a"), raw(new byte[]{'a'}));
		assertEquals(raw(new byte[]{'a'}).fingerprint(), raw(new byte[]{'a'}).fingerprint());
		assertNotEquals(raw("a").fingerprint(), raw(new byte[]{'a'}).fingerprint());
		assertNotEquals(raw(new byte[]{(byte) 128}).fingerprint(), raw(new byte[]{(byte) 129}).fingerprint());
	}
}
