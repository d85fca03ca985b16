package absstr.domain;

import absstr.ir.Tid;

import java.util.Objects;

/**
 * Names a location as seen from one point in time of the analysis.  The
 * time is the tid of the function whose frame the location is observed in.
 */
public final class AbstractIdentifier {
	private final Tid time;
	private final AbstractLocation location;

	public AbstractIdentifier(Tid time, AbstractLocation location) {
		this.time = Objects.requireNonNull(time);
		this.location = Objects.requireNonNull(location);
	}

	public Tid getTime() {
		return this.time;
	}

	public AbstractLocation getLocation() {
		return this.location;
	}

	/**
	 * @return The same location at a different time.
	 */
	public AbstractIdentifier withTime(Tid time) {
		return new AbstractIdentifier(time, this.location);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj instanceof AbstractIdentifier other) {
			return this.time.equals(other.time)
				&& this.location.equals(other.location);
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.time, this.location);
	}

	@Override
	public String toString() {
		return String.format("%s @ %s", this.location, this.time);
	}
}
