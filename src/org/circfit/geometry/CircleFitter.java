package org.circfit.geometry;

/**
 * Fits a single circle to planar points. {@link MeanCircleFit} calls one of
 * these for every window of a trajectory.
 *
 * @author circfit
 */
public interface CircleFitter {

	/**
	 * @param x
	 *            x coordinates, at least 3
	 * @param y
	 *            y coordinates, same length as x
	 * @return the fitted circle and its RMSE
	 * @throws org.circfit.util.CircleFitException
	 *             if the points are invalid or (nearly) collinear
	 */
	Circle fit(double[] x, double[] y);
}
