package org.circfit.geometry;

import org.circfit.util.CircleFitException;
import org.circfit.util.CircleFitException.Kind;
import org.circfit.util.PointCheck;

/**
 * Methods for fitting circles to coordinates
 *
 * @author circfit
 */
public class FitCircle {

	/**
	 * K&aring;sa fit as a {@link CircleFitter}
	 */
	public static final CircleFitter KASA = new CircleFitter() {
		@Override
		public Circle fit(final double[] x, final double[] y) {
			return kasaFit(x, y);
		}

		@Override
		public String toString() {
			return "Kasa";
		}
	};

	/**
	 * K&aring;sa fit: algebraic least squares fit of the points to a circle,
	 * sharing its normal equations with {@link FitCurvature}.
	 *
	 * @param x
	 *            x coordinates
	 * @param y
	 *            y coordinates, same length as x
	 * @return circle with radius, centre and RMSE of the radial error
	 * @throws CircleFitException
	 *             if the points are invalid or (nearly) collinear
	 */
	public static Circle kasaFit(final double[] x, final double[] y) {
		PointCheck.checkPlanar(x, y);
		final double[] centreC = FitCurvature.isDegenerate(x, y) ? null : FitCurvature.solve(x, y);
		if (centreC == null)
			throw new CircleFitException(Kind.COLLINEARITY,
					"The points in X and Y must not all be collinear, or nearly collinear, with each other");
		final double xc = centreC[0];
		final double yc = centreC[1];
		final double r = Math.sqrt(xc * xc + yc * yc + centreC[2]);
		return new Circle(r, xc, yc, CircleRmse.radialRmse(x, y, r, xc, yc));
	}

	/**
	 * K&aring;sa fit
	 *
	 * @param points
	 *            double[n][2] containing n (<i>x</i>, <i>y</i>) coordinates
	 * @return double[] containing (<i>x</i>, <i>y</i>) centre and radius
	 */
	public static double[] kasaFit(final double[][] points) {
		final double[][] v = Coordinates.ofMatrix(points);
		final int nPoints = v.length;
		if (nPoints > 0 && v[0].length != 2)
			throw new CircleFitException(Kind.SHAPE_MISMATCH, "Points must be double[n][2]");
		final double[] x = new double[nPoints];
		final double[] y = new double[nPoints];
		for (int n = 0; n < nPoints; n++) {
			x[n] = v[n][0];
			y[n] = v[n][1];
		}
		return kasaFit(x, y).toArray();
	}
}
