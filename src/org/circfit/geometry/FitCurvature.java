package org.circfit.geometry;

/**
 * FitCurvature Java class for estimating the curvature of 2D coordinate data
 *
 * Copyright 2026 circfit contributors
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

import org.circfit.util.PointCheck;

import Jama.LUDecomposition;
import Jama.Matrix;
import ij.IJ;

/**
 * <p>
 * Least squares fit of planar coordinates to a circle, reported as the
 * absolute curvature of the circle.
 * </p>
 * <p>
 * The fit is algebraic (K&aring;sa): the circle <i>x</i><sup>2</sup> +
 * <i>y</i><sup>2</sup> = <i>ax</i> + <i>by</i> + <i>c</i> is found from the
 * normal equations built from the moment sums of the data, solved by LU
 * decomposition. The centre is (<i>a</i>/2, <i>b</i>/2).
 * </p>
 * <p>
 * Collinear or nearly collinear points have no finite radius. They are not an
 * error here: the curvature of a straight line is 0, and the error of such a
 * fit is undefined (NaN).
 * </p>
 * <p>
 * Fits of less than a half circle of noisy data can be poor.
 * </p>
 *
 * @author circfit
 */
public class FitCurvature {

	/**
	 * Number of leading points tested for collinearity before the full point
	 * set. Tuned separately from {@link Collinearity#PREFIX_POINTS}.
	 */
	public static final int PREFIX_POINTS = 50;

	/**
	 * Absolute curvature of the circle that best fits the points
	 *
	 * @param x
	 *            x coordinates
	 * @param y
	 *            y coordinates, same length as x
	 * @return curvature &ge; 0; 0 for (nearly) collinear points
	 * @throws org.circfit.util.CircleFitException
	 *             if x or y are not finite, differ in length or hold fewer
	 *             than 3 points
	 */
	public static double curvature(final double[] x, final double[] y) {
		return fit(x, y, false).getCurvature();
	}

	/**
	 * Absolute curvature of the circle that best fits the points and the root
	 * mean squared error of that curvature, measured in curvature space as
	 * the difference between the reciprocal distance of each point from the
	 * centre and the fitted curvature.
	 *
	 * @param x
	 *            x coordinates
	 * @param y
	 *            y coordinates, same length as x
	 * @return curvature and RMSE
	 * @throws org.circfit.util.CircleFitException
	 *             if x or y are not finite, differ in length or hold fewer
	 *             than 3 points
	 */
	public static CurvatureFit fit(final double[] x, final double[] y) {
		return fit(x, y, true);
	}

	private static CurvatureFit fit(final double[] x, final double[] y, final boolean withRmse) {
		final int nPoints = PointCheck.checkPlanar(x, y);
		final double[] centreC = isDegenerate(x, y) ? null : solve(x, y);
		if (centreC == null)
			return CurvatureFit.degenerate();

		final double xc = centreC[0];
		final double yc = centreC[1];
		final double k = Math.abs(1 / Math.sqrt(xc * xc + yc * yc + centreC[2]));
		if (!withRmse)
			return new CurvatureFit(k, Double.NaN);

		double sumSq = 0;
		for (int i = 0; i < nPoints; i++) {
			final double e = 1 / Trig.distance2D(x[i], y[i], xc, yc) - k;
			sumSq += e * e;
		}
		return new CurvatureFit(k, Math.sqrt(sumSq / nPoints));
	}

	/**
	 * Staged collinearity guard, first {@link #PREFIX_POINTS} points then all
	 * points
	 *
	 * @param x
	 * @param y
	 * @return true if no circle can be fitted
	 */
	static boolean isDegenerate(final double[] x, final double[] y) {
		final boolean degenerate = Collinearity.isCollinearPrefix(Coordinates.ofAxes(x, y), PREFIX_POINTS);
		if (degenerate && IJ.debugMode)
			IJ.log("FitCurvature: " + x.length + " points are collinear, curvature = 0");
		return degenerate;
	}

	/**
	 * Solve the normal equations of the algebraic circle fit
	 *
	 * <pre>
	 * [ Sx  Sy  n  ]   [a]   [ Sxx + Syy  ]
	 * [ Sxy Syy Sy ] . [b] = [ S(zz * y)  ]
	 * [ Sxx Sxy Sx ]   [c]   [ S(zz * x)  ]
	 * </pre>
	 *
	 * where zz = x<sup>2</sup> + y<sup>2</sup>, without inverting the matrix.
	 *
	 * @param x
	 * @param y
	 * @return double[] containing (<i>x</i>, <i>y</i>) centre and <i>c</i>,
	 *         so that <i>r</i><sup>2</sup> = <i>x</i><sup>2</sup> +
	 *         <i>y</i><sup>2</sup> + <i>c</i>; null if the system is
	 *         singular
	 */
	static double[] solve(final double[] x, final double[] y) {
		final int nPoints = x.length;
		double sx = 0, sy = 0, sxx = 0, syy = 0, sxy = 0, szzx = 0, szzy = 0;
		for (int i = 0; i < nPoints; i++) {
			final double xi = x[i];
			final double yi = y[i];
			final double xx = xi * xi;
			final double yy = yi * yi;
			final double zz = xx + yy;
			sx += xi;
			sy += yi;
			sxx += xx;
			syy += yy;
			sxy += xi * yi;
			szzx += zz * xi;
			szzy += zz * yi;
		}

		final double[][] a = { { sx, sy, nPoints }, { sxy, syy, sy }, { sxx, sxy, sx } };
		final double[][] b = { { sxx + syy }, { szzy }, { szzx } };
		final LUDecomposition lu = new LUDecomposition(new Matrix(a));
		if (!lu.isNonsingular()) {
			if (IJ.debugMode)
				IJ.log("FitCurvature: normal equations are singular for " + nPoints + " points");
			return null;
		}
		final Matrix p = lu.solve(new Matrix(b));
		final double[] centreC = { 0.5 * p.get(0, 0), 0.5 * p.get(1, 0), p.get(2, 0) };
		for (final double d : centreC) {
			if (!PointCheck.isFinite(d))
				return null;
		}
		return centreC;
	}
}
