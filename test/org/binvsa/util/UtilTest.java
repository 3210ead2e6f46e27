package org.binvsa.util;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class UtilTest {

	@Test
	public void testOptional() {
		Optional<Integer> none = Optional.none();
		Optional<Integer> one = new Optional<>(1);
		assertFalse(none.hasValue());
		assertTrue(one.hasValue());
		assertEquals(Integer.valueOf(1), one.getValue());
		assertEquals(Integer.valueOf(2), none.getValueOr(2));
		assertEquals(Integer.valueOf(1), one.getValueOr(2));
		assertSame(none, Optional.<String>optional(null));
		assertEquals(one, Optional.optional(1));
		assertNotEquals(one, none);
		assertEquals("None", none.toString());
	}

	@Test
	public void testPair() {
		Pair<Long, Byte> p = Pair.create(0x1000L, (byte) 0x41);
		assertEquals(Long.valueOf(0x1000L), p.getLeft());
		assertEquals(Byte.valueOf((byte) 0x41), p.getRight());
		assertEquals(new Pair<>(0x1000L, (byte) 0x41), p);
		assertEquals("(4096, 65)", p.toString());
	}
}
