package org.circfit.geometry;

import org.circfit.util.CircleFitException;
import org.circfit.util.CircleFitException.Kind;
import org.circfit.util.PointCheck;

/**
 * Converts the accepted coordinate layouts into a single M-by-N matrix of
 * real values, one row per point and one column per dimension.
 *
 * @author circfit
 */
public class Coordinates {

	/** Largest number of separate coordinate axes accepted */
	public static final int MAX_AXES = 3;

	/**
	 * Combine separate coordinate vectors, e.g. (x, y) or (x, y, z)
	 *
	 * @param axes
	 *            2 or 3 vectors of equal length
	 * @return double[m][n] with m points in n = axes.length dimensions
	 */
	public static double[][] ofAxes(final double[]... axes) {
		checkArity(axes == null ? 0 : axes.length);
		final String[] names = axisNames(axes.length);
		for (int a = 0; a < axes.length; a++)
			PointCheck.checkFinite(axes[a], names[a]);
		final int m = axes[0].length;
		for (int a = 1; a < axes.length; a++) {
			if (axes[a].length != m)
				throw new CircleFitException(Kind.SHAPE_MISMATCH,
						"The vectors " + join(names) + " must have the same length");
		}
		final int n = axes.length;
		final double[][] v = new double[m][n];
		for (int i = 0; i < m; i++)
			for (int a = 0; a < n; a++)
				v[i][a] = axes[a][i];
		return v;
	}

	/**
	 * Combine separate coordinate arrays that share the same dimensions, such
	 * as the x and y coordinates of a sampled grid. Values are read row by
	 * row.
	 *
	 * @param arrays
	 *            2 or 3 arrays of identical dimensions
	 * @return double[m][n] with m = total number of elements in each array
	 */
	public static double[][] ofArrays(final double[][]... arrays) {
		checkArity(arrays == null ? 0 : arrays.length);
		final String[] names = axisNames(arrays.length);
		final double[][] first = arrays[0];
		for (int a = 0; a < arrays.length; a++) {
			final double[][] array = arrays[a];
			if (array == null || array.length != first.length)
				throw new CircleFitException(Kind.SHAPE_MISMATCH,
						"The arrays " + join(names) + " must have the same dimensions");
			for (int r = 0; r < array.length; r++) {
				if (first[r] == null || array[r] == null || array[r].length != first[r].length)
					throw new CircleFitException(Kind.SHAPE_MISMATCH,
							"The arrays " + join(names) + " must have the same dimensions");
				PointCheck.checkFinite(array[r], names[a]);
			}
		}
		int m = 0;
		for (final double[] row : first)
			m += row.length;
		final double[][] axes = new double[arrays.length][m];
		for (int a = 0; a < arrays.length; a++) {
			int i = 0;
			for (final double[] row : arrays[a]) {
				System.arraycopy(row, 0, axes[a], i, row.length);
				i += row.length;
			}
		}
		return ofAxes(axes);
	}

	/**
	 * Copy an M-by-N coordinate matrix, checking that it is rectangular and
	 * finite
	 *
	 * @param v
	 *            double[m][n], rows are points
	 * @return a copy of v
	 */
	public static double[][] ofMatrix(final double[][] v) {
		if (v == null)
			throw new CircleFitException(Kind.SHAPE_MISMATCH, "V must not be null");
		final int m = v.length;
		if (m == 0)
			return new double[0][0];
		if (v[0] == null)
			throw new CircleFitException(Kind.SHAPE_MISMATCH, "V must not contain null rows");
		final int n = v[0].length;
		final double[][] copy = new double[m][];
		for (int i = 0; i < m; i++) {
			if (v[i] == null || v[i].length != n)
				throw new CircleFitException(Kind.SHAPE_MISMATCH,
						"V must be a rectangular matrix; row " + i + " does not have " + n + " columns");
			PointCheck.checkFinite(v[i], "V");
			copy[i] = v[i].clone();
		}
		return copy;
	}

	/**
	 * Map complex numbers, given as real and imaginary parts, onto the plane
	 *
	 * @param real
	 * @param imaginary
	 * @return double[m][2]
	 */
	public static double[][] ofComplex(final double[] real, final double[] imaginary) {
		PointCheck.checkFinite(real, "Re(Z)");
		PointCheck.checkFinite(imaginary, "Im(Z)");
		if (real.length != imaginary.length)
			throw new CircleFitException(Kind.SHAPE_MISMATCH,
					"The real and imaginary parts of Z must have the same length");
		return ofAxes(real, imaginary);
	}

	/**
	 * Integer coordinates, converted to floating point
	 *
	 * @param axes
	 *            2 or 3 vectors of equal length
	 * @return double[m][n]
	 */
	public static double[][] ofInts(final int[]... axes) {
		checkArity(axes == null ? 0 : axes.length);
		final double[][] d = new double[axes.length][];
		for (int a = 0; a < axes.length; a++) {
			if (axes[a] == null)
				throw new CircleFitException(Kind.SHAPE_MISMATCH, axisNames(axes.length)[a] + " must not be null");
			d[a] = new double[axes[a].length];
			for (int i = 0; i < axes[a].length; i++)
				d[a][i] = axes[a][i];
		}
		return ofAxes(d);
	}

	/**
	 * Logical coordinates, true = 1 and false = 0
	 *
	 * @param axes
	 *            2 or 3 vectors of equal length
	 * @return double[m][n]
	 */
	public static double[][] ofBooleans(final boolean[]... axes) {
		checkArity(axes == null ? 0 : axes.length);
		final double[][] d = new double[axes.length][];
		for (int a = 0; a < axes.length; a++) {
			if (axes[a] == null)
				throw new CircleFitException(Kind.SHAPE_MISMATCH, axisNames(axes.length)[a] + " must not be null");
			d[a] = new double[axes[a].length];
			for (int i = 0; i < axes[a].length; i++)
				d[a][i] = axes[a][i] ? 1 : 0;
		}
		return ofAxes(d);
	}

	private static void checkArity(final int nAxes) {
		if (nAxes < 2)
			throw new CircleFitException(Kind.INVALID_ARITY,
					"Too few input arguments: need 2 or 3 coordinate axes, got " + nAxes);
		if (nAxes > MAX_AXES)
			throw new CircleFitException(Kind.INVALID_ARITY,
					"Too many input arguments: need 2 or 3 coordinate axes, got " + nAxes);
	}

	private static String[] axisNames(final int n) {
		return n == 2 ? new String[] { "X", "Y" } : new String[] { "X", "Y", "Z" };
	}

	private static String join(final String[] names) {
		if (names.length == 2)
			return names[0] + " and " + names[1];
		return names[0] + ", " + names[1] + ", and " + names[2];
	}
}
