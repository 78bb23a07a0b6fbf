package works.splice.cache;

import com.google.common.hash.Hasher;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class FingerprintsTest {

	@Test
	void putString_distinguishesSplits() {
		Hasher ab = Fingerprints.newHasher();
		Fingerprints.putString(ab, "a");
		Fingerprints.putString(ab, "bc");
		Hasher abc = Fingerprints.newHasher();
		Fingerprints.putString(abc, "ab");
		Fingerprints.putString(abc, "c");
		assertNotEquals(ab.hash(), abc.hash());
	}

	@Test
	void putNullableString_distinguishesNullFromEmpty() {
		Hasher nullString = Fingerprints.newHasher();
		Fingerprints.putNullableString(nullString, null);
		Hasher emptyString = Fingerprints.newHasher();
		Fingerprints.putNullableString(emptyString, "");
		assertNotEquals(nullString.hash(), emptyString.hash());
	}

	@Test
	void of_isStable() {
		assertEquals(Fingerprints.of("AAAA;AACA"), Fingerprints.of("AAAA;" + "AACA"));
	}
}
