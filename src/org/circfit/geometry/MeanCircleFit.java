package org.circfit.geometry;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import org.circfit.util.CircleFitException;
import org.circfit.util.CircleFitException.Kind;
import org.circfit.util.Multithreader;
import org.circfit.util.PointCheck;

import ij.IJ;

/**
 * <p>
 * Fits circles to short windows of an ordered trajectory and averages their
 * radii.
 * </p>
 * <p>
 * Where the data drift systematically, e.g. a slowly spiralling trajectory,
 * one global circle describes none of it well. The mean of the local radii
 * estimates the typical local radius of curvature instead.
 * </p>
 * <p>
 * For a window width <i>w</i> and half width <i>h</i> = floor(<i>w</i>/2),
 * a circle is fitted to points <i>i</i> - <i>h</i> to <i>i</i> + <i>h</i>
 * for every index <i>i</i> at least <i>h</i> from both ends of the data. The
 * first and last <i>h</i> indices have no radius of their own.
 * </p>
 *
 * @author circfit
 */
public class MeanCircleFit {

	/** Smallest window width; leaves 3 points for each fit */
	public static final int MIN_WINDOW = 2;

	/**
	 * Mean local radius using {@link FitCircle#KASA}
	 *
	 * @param x
	 *            x coordinates in trajectory order
	 * @param y
	 *            y coordinates, same length as x
	 * @param w
	 *            window width, &ge; 2
	 * @return mean of the windowed radii
	 * @throws CircleFitException
	 *             if the points or w are invalid, if the trajectory is shorter
	 *             than one window, or if a window cannot be fitted
	 */
	public static double meanRadius(final double[] x, final double[] y, final int w) {
		return meanRadius(x, y, w, FitCircle.KASA);
	}

	/**
	 * Mean local radius for a window width given as a floating point value,
	 * which must be a whole number
	 *
	 * @param x
	 * @param y
	 * @param w
	 *            window width, a finite integer &ge; 2
	 * @return mean of the windowed radii
	 */
	public static double meanRadius(final double[] x, final double[] y, final double w) {
		PointCheck.checkPlanar(x, y);
		if (!PointCheck.isFinite(w))
			throw new CircleFitException(Kind.INVALID_SCALAR_PARAMETER, "W must be a finite real integer; W = " + w);
		if (w < MIN_WINDOW || w != Math.floor(w) || w > Integer.MAX_VALUE)
			throw new CircleFitException(Kind.INVALID_SCALAR_PARAMETER,
					"W must be a finite real integer greater than or equal to two; W = " + w);
		return meanRadius(x, y, (int) w);
	}

	/**
	 * Mean local radius, one window after another
	 *
	 * @param x
	 * @param y
	 * @param w
	 *            window width, &ge; 2
	 * @param fitter
	 *            fits each window
	 * @return mean of the windowed radii
	 */
	public static double meanRadius(final double[] x, final double[] y, final int w, final CircleFitter fitter) {
		return meanRadius(x, y, w, fitter, 1);
	}

	/**
	 * Mean local radius with the windows shared between worker threads. The
	 * radii are summed in trajectory order, so the result does not depend on
	 * the number of threads.
	 *
	 * @param x
	 * @param y
	 * @param w
	 *            window width, &ge; 2
	 * @param fitter
	 *            fits each window, must be safe to call from several threads
	 * @param nThreads
	 *            number of worker threads; 1 fits on the calling thread
	 * @return mean of the windowed radii
	 */
	public static double meanRadius(final double[] x, final double[] y, final int w, final CircleFitter fitter,
			final int nThreads) {
		final double[] radii = localRadii(x, y, w, fitter, nThreads);
		final int hw = w / 2;
		double sum = 0;
		for (int i = hw; i < radii.length - hw; i++)
			sum += radii[i];
		return sum / (radii.length - 2 * hw);
	}

	/**
	 * Mean local radius with ImageJ's preferred number of threads
	 *
	 * @param x
	 * @param y
	 * @param w
	 *            window width, &ge; 2
	 * @param fitter
	 *            fits each window, must be safe to call from several threads
	 * @return mean of the windowed radii
	 */
	public static double meanRadiusMultithreaded(final double[] x, final double[] y, final int w,
			final CircleFitter fitter) {
		return meanRadius(x, y, w, fitter, Multithreader.newThreads().length);
	}

	/**
	 * Radius of the circle fitted around each index
	 *
	 * @param x
	 * @param y
	 * @param w
	 *            window width, &ge; 2
	 * @return double[x.length] of radii; the first and last floor(w/2) values
	 *         are 0
	 */
	public static double[] localRadii(final double[] x, final double[] y, final int w) {
		return localRadii(x, y, w, FitCircle.KASA, 1);
	}

	/**
	 * Radius of the circle fitted around each index
	 *
	 * @param x
	 * @param y
	 * @param w
	 *            window width, &ge; 2
	 * @param fitter
	 *            fits each window
	 * @param nThreads
	 *            number of worker threads; 1 fits on the calling thread
	 * @return double[x.length] of radii; the first and last floor(w/2) values
	 *         are 0
	 */
	public static double[] localRadii(final double[] x, final double[] y, final int w, final CircleFitter fitter,
			final int nThreads) {
		final int nPoints = PointCheck.checkPlanar(x, y);
		if (w < MIN_WINDOW)
			throw new CircleFitException(Kind.INVALID_SCALAR_PARAMETER,
					"W must be a finite real integer greater than or equal to two; W = " + w);
		final int hw = w / 2;
		if (2 * hw + 1 > nPoints)
			throw new CircleFitException(Kind.TOO_FEW_POINTS, "A window of W = " + w + " needs " + (2 * hw + 1)
					+ " points; n = " + nPoints);

		final int last = nPoints - hw;
		if (IJ.debugMode)
			IJ.log("MeanCircleFit: fitting " + (last - hw) + " windows of " + (2 * hw + 1) + " points with "
					+ fitter);

		final double[] radii = new double[nPoints];
		if (nThreads <= 1) {
			for (int i = hw; i < last; i++)
				radii[i] = fitWindow(x, y, i, hw, fitter);
			return radii;
		}

		final AtomicInteger ai = new AtomicInteger(hw);
		Multithreader.startTask(new Runnable() {
			public void run() {
				for (int i = ai.getAndIncrement(); i < last; i = ai.getAndIncrement())
					radii[i] = fitWindow(x, y, i, hw, fitter);
			}
		}, nThreads);
		return radii;
	}

	private static double fitWindow(final double[] x, final double[] y, final int i, final int hw,
			final CircleFitter fitter) {
		final double[] wx = Arrays.copyOfRange(x, i - hw, i + hw + 1);
		final double[] wy = Arrays.copyOfRange(y, i - hw, i + hw + 1);
		return fitter.fit(wx, wy).getRadius();
	}
}
