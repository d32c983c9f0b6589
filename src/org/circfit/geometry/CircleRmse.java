package org.circfit.geometry;

import org.circfit.util.CircleFitException;
import org.circfit.util.CircleFitException.Kind;
import org.circfit.util.PointCheck;

/**
 * Root mean squared error of position data relative to a circle
 *
 * @author circfit
 */
public class CircleRmse {

	/**
	 * Point sets smaller than this are checked for collinearity before
	 * scoring. Collinearity in larger noisy samples is not tested.
	 */
	public static final int COLLINEARITY_CHECK_LIMIT = 20;

	/**
	 * Root mean squared radial error of the points relative to a circle of
	 * radius r centred at (xc, yc), or at the origin if no centre is given.
	 *
	 * @param x
	 *            x coordinates
	 * @param y
	 *            y coordinates, same length as x
	 * @param r
	 *            radius, &ge; 0
	 * @param centre
	 *            either nothing or both (<i>xc</i>, <i>yc</i>)
	 * @return RMSE in the units of the coordinates
	 * @throws CircleFitException
	 *             if the points are invalid, r is negative or not finite, the
	 *             centre has 1 or more than 2 values, or fewer than
	 *             {@link #COLLINEARITY_CHECK_LIMIT} points are (nearly)
	 *             collinear
	 */
	public static double rmse(final double[] x, final double[] y, final double r, final double... centre) {
		PointCheck.checkPlanar(x, y);
		PointCheck.checkFinite(r, "R");
		if (r < 0)
			throw new CircleFitException(Kind.INVALID_SCALAR_PARAMETER, "R must be a positive value; R = " + r);

		double xc = 0;
		double yc = 0;
		if (centre != null && centre.length > 0) {
			if (centre.length == 1)
				throw new CircleFitException(Kind.INVALID_ARITY,
						"Either both XC and YC must be specified or neither");
			if (centre.length > 2)
				throw new CircleFitException(Kind.INVALID_ARITY,
						"Too many input arguments: centre has " + centre.length + " values");
			PointCheck.checkFinite(centre[0], "XC");
			PointCheck.checkFinite(centre[1], "YC");
			xc = centre[0];
			yc = centre[1];
		}

		if (x.length < COLLINEARITY_CHECK_LIMIT && Collinearity.isCollinearClosedLoop(Coordinates.ofAxes(x, y)))
			throw new CircleFitException(Kind.COLLINEARITY,
					"The points in X and Y must not all be collinear, or nearly collinear, with each other");

		return radialRmse(x, y, r, xc, yc);
	}

	/**
	 * Root mean squared radial error of the points relative to a circle
	 *
	 * @param x
	 * @param y
	 * @param circle
	 * @return RMSE in the units of the coordinates
	 * @see #rmse(double[], double[], double, double...)
	 */
	public static double rmse(final double[] x, final double[] y, final Circle circle) {
		if (circle == null)
			throw new CircleFitException(Kind.SHAPE_MISMATCH, "Circle must not be null");
		return rmse(x, y, circle.getRadius(), circle.getCentreX(), circle.getCentreY());
	}

	/**
	 * Unchecked RMSE for callers that already validated their points
	 */
	static double radialRmse(final double[] x, final double[] y, final double r, final double xc,
			final double yc) {
		final int nPoints = x.length;
		double sumSq = 0;
		for (int i = 0; i < nPoints; i++) {
			final double e = Trig.distance2D(x[i], y[i], xc, yc) - r;
			sumSq += e * e;
		}
		return Math.sqrt(sumSq / nPoints);
	}
}
