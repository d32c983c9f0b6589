package org.circfit.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.circfit.util.CircleFitException.Kind;
import org.junit.Test;

public class PointCheckTest {

	@Test
	public void testCheckPlanar() {
		assertEquals(3, PointCheck.checkPlanar(new double[] { 1, 2, 3 }, new double[] { 4, 5, 6 }));
	}

	@Test
	public void testIsFinite() {
		assertTrue(PointCheck.isFinite(0));
		assertTrue(PointCheck.isFinite(-Double.MAX_VALUE));
		assertFalse(PointCheck.isFinite(Double.NaN));
		assertFalse(PointCheck.isFinite(Double.NEGATIVE_INFINITY));
	}

	@Test
	public void testFailureNamesTheValue() {
		try {
			PointCheck.checkFinite(new double[] { 1, Double.POSITIVE_INFINITY }, "X");
			fail();
		} catch (final CircleFitException e) {
			assertEquals(Kind.NON_FINITE_INPUT, e.getKind());
			assertTrue(e.getMessage().contains("X[1]"));
		}
	}

	@Test
	public void testLengthMismatchBeforePointCount() {
		try {
			PointCheck.checkPlanar(new double[] { 1 }, new double[] { 1, 2 });
			fail();
		} catch (final CircleFitException e) {
			assertEquals(Kind.SHAPE_MISMATCH, e.getKind());
		}
	}
}
