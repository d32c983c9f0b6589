package org.circfit.geometry;

/**
 * Provides simple planar distance calculations
 *
 * @author circfit
 */
public class Trig {

	/**
	 * <p>
	 * Calculate the distance between 2 2D points <i>p</i>(x, y) and <i>q</i>
	 * (x, y) using Pythagoras' theorem, <i>a</i><sup>2</sup> =
	 * <i>b</i><sup>2</sup> + <i>c</i><sup>2</sup>
	 * </p>
	 *
	 * @param px
	 *            x-coordinate of first point
	 * @param py
	 *            y-coordinate of first point
	 * @param qx
	 *            x-coordinate of second point
	 * @param qy
	 *            y-coordinate of second point
	 * @return distance between <i>p</i> and <i>q</i>
	 */
	public static double distance2D(final double px, final double py, final double qx, final double qy) {
		return distance2D(px - qx, py - qy);
	}

	/**
	 * Calculate the distance to the origin, (0,0)
	 *
	 * @param x
	 * @param y
	 * @return
	 */
	public static double distance2D(final double x, final double y) {
		return Math.sqrt(x * x + y * y);
	}
}
