package org.circfit.geometry;

/**
 * Immutable circle: radius, centre and, for fitted circles, the root mean
 * squared error of the fit.
 *
 * @author circfit
 */
public class Circle {

	private final double radius;
	private final double centreX;
	private final double centreY;
	private final double rmse;

	/**
	 * A candidate circle that was not fitted to data; its RMSE is NaN.
	 *
	 * @param radius
	 * @param centreX
	 * @param centreY
	 */
	public Circle(final double radius, final double centreX, final double centreY) {
		this(radius, centreX, centreY, Double.NaN);
	}

	/**
	 * @param radius
	 * @param centreX
	 * @param centreY
	 * @param rmse
	 *            root mean squared radial error of the fit
	 */
	public Circle(final double radius, final double centreX, final double centreY, final double rmse) {
		this.radius = radius;
		this.centreX = centreX;
		this.centreY = centreY;
		this.rmse = rmse;
	}

	public double getRadius() {
		return radius;
	}

	public double getCentreX() {
		return centreX;
	}

	public double getCentreY() {
		return centreY;
	}

	/**
	 * @return RMSE of the fit in the units of the coordinates, NaN if the
	 *         circle was not fitted
	 */
	public double getRmse() {
		return rmse;
	}

	/**
	 * @return 1 / radius
	 */
	public double getCurvature() {
		return 1 / radius;
	}

	/**
	 * @return (x, y) centre and radius, the layout returned by the fitting
	 *         methods in {@link FitCircle}
	 */
	public double[] toArray() {
		final double[] centreRadius = { centreX, centreY, radius };
		return centreRadius;
	}

	@Override
	public String toString() {
		return "Circle [r = " + radius + ", centre = (" + centreX + ", " + centreY + "), rmse = " + rmse + "]";
	}
}
