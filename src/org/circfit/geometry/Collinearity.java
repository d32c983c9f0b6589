package org.circfit.geometry;

/**
 * Collinearity test for N-dimensional rectilinear point data
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

import java.math.BigDecimal;
import java.math.MathContext;

import Jama.Matrix;
import Jama.SingularValueDecomposition;
import ij.IJ;

/**
 * <p>
 * Decides whether points are collinear, or so nearly collinear that they are
 * numerically indistinguishable from a straight line.
 * </p>
 * <p>
 * The points are treated as a closed loop: the first point is appended after
 * the last and the consecutive difference vectors are stacked into a matrix.
 * The points are collinear when that matrix has rank 1, with the rank taken
 * from a singular value decomposition with the usual tolerance
 * <i>max(m, n)</i> &middot; ulp(<i>&sigma;<sub>max</sub></i>). Nearly
 * collinear floating-point data may therefore be labelled collinear, as
 * they produce the same singularities in a linear solve.
 * </p>
 * <p>
 * Large inputs are tested on a prefix of {@link #PREFIX_POINTS} points first.
 * A non-collinear prefix is trusted and returned at once; a collinear prefix is
 * confirmed against all of the points.
 * </p>
 *
 * @author circfit
 */
public class Collinearity {

	/** Number of leading points tested before the full point set */
	public static final int PREFIX_POINTS = 64;

	/**
	 * Planar points given as separate coordinate vectors
	 *
	 * @param x
	 * @param y
	 * @return true if the points are (nearly) collinear. Always true for two
	 *         or fewer points.
	 */
	public static boolean isCollinear(final double[] x, final double[] y) {
		return isCollinearPrefix(Coordinates.ofAxes(x, y), PREFIX_POINTS);
	}

	/**
	 * 3D points given as separate coordinate vectors
	 *
	 * @param x
	 * @param y
	 * @param z
	 * @return true if the points are (nearly) collinear
	 */
	public static boolean isCollinear(final double[] x, final double[] y, final double[] z) {
		return isCollinearPrefix(Coordinates.ofAxes(x, y, z), PREFIX_POINTS);
	}

	/**
	 * N-dimensional points
	 *
	 * @param v
	 *            double[m][n] holding m points with n coordinates each
	 * @return true if the points are (nearly) collinear. Always true when m
	 *         &le; 2 or n &le; 1.
	 */
	public static boolean isCollinear(final double[][] v) {
		return isCollinearPrefix(Coordinates.ofMatrix(v), PREFIX_POINTS);
	}

	/**
	 * Integer coordinate vectors
	 *
	 * @param axes
	 *            2 or 3 vectors of equal length
	 * @return true if the points are (nearly) collinear
	 */
	public static boolean isCollinear(final int[]... axes) {
		return isCollinearPrefix(Coordinates.ofInts(axes), PREFIX_POINTS);
	}

	/**
	 * Logical coordinate vectors
	 *
	 * @param axes
	 *            2 or 3 vectors of equal length
	 * @return true if the points are (nearly) collinear
	 */
	public static boolean isCollinear(final boolean[]... axes) {
		return isCollinearPrefix(Coordinates.ofBooleans(axes), PREFIX_POINTS);
	}

	/**
	 * Coordinate arrays of identical dimensions, e.g. sampled grids
	 *
	 * @param arrays
	 *            2 or 3 arrays
	 * @return true if the points are (nearly) collinear
	 */
	public static boolean isCollinearArrays(final double[][]... arrays) {
		return isCollinearPrefix(Coordinates.ofArrays(arrays), PREFIX_POINTS);
	}

	/**
	 * Points on the complex plane
	 *
	 * @param real
	 *            real parts
	 * @param imaginary
	 *            imaginary parts
	 * @return true if the points are (nearly) collinear on the complex plane
	 */
	public static boolean isCollinearComplex(final double[] real, final double[] imaginary) {
		return isCollinearPrefix(Coordinates.ofComplex(real, imaginary), PREFIX_POINTS);
	}

	/**
	 * Staged test: the first <i>prefix</i> points closed onto the first point,
	 * then, only if those are collinear and more points remain, all points.
	 *
	 * @param v
	 *            double[m][n] normalised coordinates, not checked
	 * @param prefix
	 *            number of leading points in the first stage
	 * @return true if the points are (nearly) collinear
	 */
	public static boolean isCollinearPrefix(final double[][] v, final int prefix) {
		final int m = v.length;
		if (m <= 2 || v[0].length <= 1)
			return true;
		final int mx = Math.min(m, prefix);
		boolean collinear = rank(closedLoopDifferences(v, mx)) == 1;
		if (collinear && m > prefix) {
			if (IJ.debugMode)
				IJ.log("First " + mx + " of " + m + " points are collinear, testing all points");
			collinear = rank(closedLoopDifferences(v, m)) == 1;
		}
		return collinear;
	}

	/**
	 * Single-stage test over all points
	 *
	 * @param v
	 *            double[m][n] normalised coordinates, not checked
	 * @return true if the points are (nearly) collinear
	 */
	public static boolean isCollinearClosedLoop(final double[][] v) {
		final int m = v.length;
		if (m <= 2 || v[0].length <= 1)
			return true;
		return rank(closedLoopDifferences(v, m)) == 1;
	}

	/**
	 * Difference vectors around the loop p<sub>0</sub>, p<sub>1</sub>, ...
	 * p<sub>count-1</sub>, p<sub>0</sub>
	 *
	 * @param v
	 *            points
	 * @param count
	 *            number of leading points in the loop
	 * @return double[count][n]
	 */
	static double[][] closedLoopDifferences(final double[][] v, final int count) {
		final int n = v[0].length;
		final double[][] d = new double[count][n];
		for (int i = 0; i < count; i++) {
			final double[] p = v[i];
			final double[] q = v[(i + 1) % count];
			for (int j = 0; j < n; j++)
				d[i][j] = q[j] - p[j];
		}
		return d;
	}

	/**
	 * Numerical rank: the number of singular values greater than
	 * <i>max(m, n)</i> &middot; ulp(<i>&sigma;<sub>max</sub></i>). Jama's SVD
	 * needs at least as many rows as columns, and rank is unchanged by
	 * transposition.
	 * <p>
	 * Jama's small singular values can be out by about one ulp of
	 * <i>&sigma;<sub>max</sub></i>, which is the width of the tolerance
	 * itself. When any singular value falls within a factor of
	 * {@link #REFINE_BAND} of the tolerance the count is redone exactly by
	 * {@link #countSingularValuesAbove(double[][], double)}.
	 * </p>
	 *
	 * @param d
	 * @return effective rank of d
	 */
	static int rank(final double[][] d) {
		Matrix D = new Matrix(d);
		if (D.getRowDimension() < D.getColumnDimension())
			D = D.transpose();
		final double[] s = new SingularValueDecomposition(D).getSingularValues();
		final double tol = Math.max(D.getRowDimension(), D.getColumnDimension()) * Math.ulp(s[0]);
		int r = 0;
		boolean nearTolerance = false;
		for (int i = 0; i < s.length; i++) {
			if (s[i] > tol)
				r++;
			if (s[i] > tol / REFINE_BAND && s[i] <= tol * REFINE_BAND)
				nearTolerance = true;
		}
		if (!nearTolerance)
			return r;
		final int exact = countSingularValuesAbove(D.getArray(), tol);
		if (IJ.debugMode && exact != r)
			IJ.log("Collinearity: SVD rank " + r + " corrected to " + exact + " at tolerance " + tol);
		return exact;
	}

	/** Factor either side of the rank tolerance treated as ambiguous */
	static final double REFINE_BAND = 8;

	private static final MathContext MC = new MathContext(160);

	/**
	 * Counts the singular values of d that are greater than tol without
	 * rounding the Gram matrix. <i>d<sup>T</sup>d</i> is formed exactly, tol
	 * <sup>2</sup> is subtracted from its diagonal, and the positive pivots of
	 * the symmetric elimination are counted (Sylvester's law of inertia).
	 * A pivot of exactly zero counts as not greater than tol.
	 *
	 * @param d
	 *            m x n matrix, m &ge; n
	 * @param tol
	 * @return number of singular values of d greater than tol
	 */
	static int countSingularValuesAbove(final double[][] d, final double tol) {
		final int m = d.length;
		final int n = d[0].length;
		final BigDecimal[][] e = new BigDecimal[m][n];
		for (int i = 0; i < m; i++)
			for (int j = 0; j < n; j++)
				e[i][j] = new BigDecimal(d[i][j]);

		final BigDecimal tau = new BigDecimal(tol).pow(2);
		final BigDecimal[][] g = new BigDecimal[n][n];
		for (int j = 0; j < n; j++) {
			for (int k = j; k < n; k++) {
				BigDecimal sum = BigDecimal.ZERO;
				for (int i = 0; i < m; i++)
					sum = sum.add(e[i][j].multiply(e[i][k]));
				g[j][k] = sum;
				g[k][j] = sum;
			}
			g[j][j] = g[j][j].subtract(tau);
		}

		int positive = 0;
		for (int k = 0; k < n; k++) {
			BigDecimal pivot = g[k][k];
			if (pivot.signum() == 0)
				pivot = tau.negate().scaleByPowerOfTen(-40);
			if (pivot.signum() > 0)
				positive++;
			for (int i = k + 1; i < n; i++) {
				final BigDecimal f = g[i][k].divide(pivot, MC);
				for (int j = k + 1; j < n; j++)
					g[i][j] = g[i][j].subtract(f.multiply(g[k][j], MC), MC);
			}
		}
		return positive;
	}
}
