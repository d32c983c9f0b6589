package org.circfit.geometry;

/**
 * Result of {@link FitCurvature#fit(double[], double[])}: absolute curvature
 * and its root mean squared error.
 *
 * @author circfit
 */
public class CurvatureFit {

	private final double curvature;
	private final double rmse;
	private final boolean degenerate;

	CurvatureFit(final double curvature, final double rmse) {
		this(curvature, rmse, false);
	}

	private CurvatureFit(final double curvature, final double rmse, final boolean degenerate) {
		this.curvature = curvature;
		this.rmse = rmse;
		this.degenerate = degenerate;
	}

	/**
	 * Result for (nearly) collinear points: zero curvature, undefined error
	 *
	 * @return degenerate fit
	 */
	static CurvatureFit degenerate() {
		return new CurvatureFit(0, Double.NaN, true);
	}

	/**
	 * @return absolute curvature, 0 when the points are (nearly) collinear
	 */
	public double getCurvature() {
		return curvature;
	}

	/**
	 * @return root mean squared error in curvature space, NaN when the points
	 *         are (nearly) collinear
	 */
	public double getRmse() {
		return rmse;
	}

	/**
	 * @return true if the points did not define a circle
	 */
	public boolean isDegenerate() {
		return degenerate;
	}

	@Override
	public String toString() {
		return "CurvatureFit [k = " + curvature + ", rmse = " + rmse + "]";
	}
}
