package org.circfit.util;

/**
 * Thrown when the arguments of a fitting or scoring operation cannot be used.
 * All checks are made before any numeric work starts, so a caller never sees
 * a partial result.
 *
 * @author circfit
 */
@SuppressWarnings("serial")
public class CircleFitException extends IllegalArgumentException {

	/**
	 * Category of the rejected input
	 */
	public enum Kind {
		/** coordinate inputs disagree in length or dimensions */
		SHAPE_MISMATCH,
		/** NaN or infinite value where a finite real is required */
		NON_FINITE_INPUT,
		/** fewer points than the algorithm needs */
		TOO_FEW_POINTS,
		/** window width or radius outside its allowed range */
		INVALID_SCALAR_PARAMETER,
		/** wrong number of coordinate axes or centre values */
		INVALID_ARITY,
		/** points are (nearly) collinear and no circle can be answered */
		COLLINEARITY
	}

	private final Kind kind;

	public CircleFitException(final Kind kind, final String message) {
		super(message);
		this.kind = kind;
	}

	/**
	 * @return the category of the failure
	 */
	public Kind getKind() {
		return kind;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " [" + kind + "]: " + getMessage();
	}
}
