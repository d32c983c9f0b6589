package org.circfit.geometry;

import static org.circfit.geometry.CollinearityTest.assertKind;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

import org.circfit.util.CircleFitException.Kind;
import org.junit.Test;

public class CoordinatesTest {

	@Test
	public void testOfAxes() {
		final double[][] v = Coordinates.ofAxes(new double[] { 1, 2 }, new double[] { 3, 4 }, new double[] { 5, 6 });
		assertEquals(2, v.length);
		assertArrayEquals(new double[] { 1, 3, 5 }, v[0], 0);
		assertArrayEquals(new double[] { 2, 4, 6 }, v[1], 0);
	}

	@Test
	public void testOfArraysReadsRowByRow() {
		final double[][] x = { { 1, 2 }, { 3, 4 } };
		final double[][] y = { { 5, 6 }, { 7, 8 } };
		final double[][] v = Coordinates.ofArrays(x, y);
		assertEquals(4, v.length);
		assertArrayEquals(new double[] { 2, 6 }, v[1], 0);
		assertArrayEquals(new double[] { 3, 7 }, v[2], 0);
	}

	@Test
	public void testOfMatrixCopies() {
		final double[][] m = { { 1, 2 }, { 3, 4 }, { 5, 6 } };
		final double[][] v = Coordinates.ofMatrix(m);
		assertNotSame(m[0], v[0]);
		assertArrayEquals(m[2], v[2], 0);
	}

	@Test
	public void testOfComplex() {
		final double[][] v = Coordinates.ofComplex(new double[] { 1, -1 }, new double[] { 2, -2 });
		assertArrayEquals(new double[] { 1, 2 }, v[0], 0);
		assertArrayEquals(new double[] { -1, -2 }, v[1], 0);
	}

	@Test
	public void testOfIntsAndBooleans() {
		final double[][] v = Coordinates.ofInts(new int[] { 1, -2 }, new int[] { 3, 4 });
		assertArrayEquals(new double[] { -2, 4 }, v[1], 0);
		final double[][] b = Coordinates.ofBooleans(new boolean[] { true, false }, new boolean[] { false, true });
		assertArrayEquals(new double[] { 1, 0 }, b[0], 0);
		assertArrayEquals(new double[] { 0, 1 }, b[1], 0);
	}

	@Test
	public void testRejected() {
		assertKind(Kind.SHAPE_MISMATCH, new Runnable() {
			public void run() {
				Coordinates.ofComplex(new double[] { 1, 2 }, new double[] { 1 });
			}
		});
		assertKind(Kind.SHAPE_MISMATCH, new Runnable() {
			public void run() {
				Coordinates.ofAxes(new double[] { 1, 2 }, null);
			}
		});
		assertKind(Kind.SHAPE_MISMATCH, new Runnable() {
			public void run() {
				Coordinates.ofMatrix(null);
			}
		});
		assertKind(Kind.INVALID_ARITY, new Runnable() {
			public void run() {
				Coordinates.ofAxes(new double[] { 1, 2 });
			}
		});
		assertKind(Kind.INVALID_ARITY, new Runnable() {
			public void run() {
				final double[] a = { 1, 2 };
				Coordinates.ofAxes(a, a, a, a);
			}
		});
		assertKind(Kind.NON_FINITE_INPUT, new Runnable() {
			public void run() {
				Coordinates.ofArrays(new double[][] { { 1, Double.NaN } }, new double[][] { { 1, 2 } });
			}
		});
	}
}
