package works.datashape.lifetime;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import works.datashape.de.Visitor;
import works.datashape.exceptions.BorrowUnavailableException;

import static works.datashape.lifetime.Flavor.BORROWED;
import static works.datashape.lifetime.Flavor.OWNED;
import static works.datashape.lifetime.Flavor.TRANSIENT;

/**
 * Negotiation between what a consumer can supply and what a visitor accepts.
 */
public final class Flavors {
	public static final Set<Flavor> ALL = Collections.unmodifiableSet(EnumSet.allOf(Flavor.class));

	/**
	 * What a consumer can offer when it reads from a source whose bytes
	 * do not stay put, like a stream.
	 */
	public static final Set<Flavor> NOT_BORROWABLE = Collections.unmodifiableSet(EnumSet.of(TRANSIENT, OWNED));

	public static final Set<Flavor> BORROWED_ONLY = Collections.unmodifiableSet(EnumSet.of(BORROWED));

	private Flavors() {}

	/**
	 * Called by the default visitor methods before they accept data of the {@code offered} flavor.
	 *
	 * @throws BorrowUnavailableException if the visitor does not accept {@code offered}
	 * because it insists on borrowed data
	 */
	public static void requireAccepted(Visitor<?> visitor, Flavor offered) {
		Set<Flavor> accepted = visitor.acceptedFlavors();
		if (!accepted.contains(offered) && accepted.contains(BORROWED)) {
			throw new BorrowUnavailableException(offered, visitor.expecting());
		}
	}
}
