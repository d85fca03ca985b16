package absstr.domain;

/**
 * An abstract domain for string contents, usable by the string analysis.
 */
public interface StringDomain<T extends StringDomain<T>>
	extends AbstractDomain<T>, HasTop<T>, DomainInsertion<T> {
}
