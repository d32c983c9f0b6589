package org.circfit.util;

import org.circfit.util.CircleFitException.Kind;

/**
 * Check that coordinate data conform to the contract of each method before
 * it is handed to a fitting routine.
 *
 * @author circfit
 *
 */
public class PointCheck {

	/**
	 * Minimum number of points that define a circle
	 */
	public static final int MIN_POINTS = 3;

	/**
	 * Check a pair of planar coordinate vectors
	 *
	 * @param x
	 *            x coordinates
	 * @param y
	 *            y coordinates
	 * @return number of points
	 * @throws CircleFitException
	 *             if either vector is null or contains a non-finite value, if
	 *             the lengths differ or if there are fewer than 3 points
	 */
	public static int checkPlanar(final double[] x, final double[] y) {
		checkFinite(x, "X");
		checkFinite(y, "Y");
		final int l = x.length;
		if (l != y.length)
			throw new CircleFitException(Kind.SHAPE_MISMATCH,
					"Length mismatch: the vectors X and Y must have the same length (" + l + " != " + y.length + ")");
		if (l < MIN_POINTS)
			throw new CircleFitException(Kind.TOO_FEW_POINTS,
					"The vectors X and Y must contain at least three points; n = " + l);
		return l;
	}

	/**
	 * Check that a vector exists and that all its values are finite
	 *
	 * @param v
	 * @param name
	 *            name used in the failure message
	 */
	public static void checkFinite(final double[] v, final String name) {
		if (v == null)
			throw new CircleFitException(Kind.SHAPE_MISMATCH, name + " must not be null");
		for (int i = 0; i < v.length; i++) {
			if (!isFinite(v[i]))
				throw new CircleFitException(Kind.NON_FINITE_INPUT,
						name + " must be a finite real vector; " + name + "[" + i + "] = " + v[i]);
		}
	}

	/**
	 * Check that a scalar parameter is finite
	 *
	 * @param s
	 * @param name
	 *            name used in the failure message
	 */
	public static void checkFinite(final double s, final String name) {
		if (!isFinite(s))
			throw new CircleFitException(Kind.NON_FINITE_INPUT, name + " must be a finite real scalar; " + name
					+ " = " + s);
	}

	/**
	 * @param d
	 * @return true if d is neither NaN nor infinite
	 */
	public static boolean isFinite(final double d) {
		return !Double.isNaN(d) && !Double.isInfinite(d);
	}
}
