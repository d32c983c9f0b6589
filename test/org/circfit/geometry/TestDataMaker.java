package org.circfit.geometry;

import java.util.Random;

/**
 * Static methods to generate coordinates for testing
 *
 * @author circfit
 */
public class TestDataMaker {

	/**
	 * Generate coordinates of a circular arc
	 *
	 * @param x
	 *            x coordinate of centre
	 * @param y
	 *            y coordinate of centre
	 * @param r
	 *            radius of circle
	 * @param n
	 *            Number of coordinates
	 * @param startAngle
	 *            initial angle in radians
	 * @param endAngle
	 *            final angle in radians
	 * @param noise
	 *            Add noise of intensity 'noise'
	 * @param seed
	 *            seed of the noise
	 * @return double[2][n] holding the x and the y coordinates
	 */
	public static double[][] testCircle(final double x, final double y, final double r, final int n,
			final double startAngle, final double endAngle, final double noise, final long seed) {
		final Random random = new Random(seed);
		final double[][] xy = new double[2][n];
		final double arc = (endAngle - startAngle) / (2 * Math.PI);
		for (int i = 0; i < n; i++) {
			final double theta = startAngle + i * 2 * Math.PI * arc / n;
			xy[0][i] = r * (1 + noise * (random.nextDouble() - 0.5)) * Math.sin(theta) + x;
			xy[1][i] = r * (1 + noise * (random.nextDouble() - 0.5)) * Math.cos(theta) + y;
		}
		return xy;
	}

	/**
	 * Generate coordinates of a full circle without noise
	 *
	 * @param x
	 * @param y
	 * @param r
	 * @param n
	 * @return double[2][n] holding the x and the y coordinates
	 */
	public static double[][] testCircle(final double x, final double y, final double r, final int n) {
		return testCircle(x, y, r, n, 0, 2 * Math.PI, 0, 0);
	}

	/**
	 * Equally spaced points on the line y = slope * x + intercept
	 *
	 * @param n
	 * @param slope
	 * @param intercept
	 * @return double[2][n] holding the x and the y coordinates
	 */
	public static double[][] line(final int n, final double slope, final double intercept) {
		final double[][] xy = new double[2][n];
		for (int i = 0; i < n; i++) {
			xy[0][i] = i;
			xy[1][i] = slope * i + intercept;
		}
		return xy;
	}

	/**
	 * Archimedean spiral, r = a + b&theta;, sampled at equal angles
	 *
	 * @param a
	 *            radius at &theta; = 0
	 * @param b
	 *            growth of the radius per radian
	 * @param turns
	 *            number of revolutions
	 * @param n
	 *            Number of coordinates
	 * @return double[2][n] holding the x and the y coordinates
	 */
	public static double[][] spiral(final double a, final double b, final double turns, final int n) {
		final double[][] xy = new double[2][n];
		for (int i = 0; i < n; i++) {
			final double theta = i * 2 * Math.PI * turns / n;
			final double r = a + b * theta;
			xy[0][i] = r * Math.cos(theta);
			xy[1][i] = r * Math.sin(theta);
		}
		return xy;
	}

	/**
	 * Mean of the radius of curvature of an Archimedean spiral over the
	 * points returned by {@link #spiral(double, double, double, int)},
	 * leaving out hw points at each end
	 *
	 * @param a
	 * @param b
	 * @param turns
	 * @param n
	 * @param hw
	 * @return mean radius of curvature
	 */
	public static double spiralMeanRadiusOfCurvature(final double a, final double b, final double turns,
			final int n, final int hw) {
		double sum = 0;
		for (int i = hw; i < n - hw; i++) {
			final double theta = i * 2 * Math.PI * turns / n;
			final double r = a + b * theta;
			final double r2 = r * r;
			final double b2 = b * b;
			sum += Math.pow(r2 + b2, 1.5) / (r2 + 2 * b2);
		}
		return sum / (n - 2 * hw);
	}
}
