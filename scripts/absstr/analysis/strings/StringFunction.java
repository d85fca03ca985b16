package absstr.analysis.strings;

import absstr.domain.StringDomain;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Optional;

/**
 * Library functions whose effect on strings is known.
 *
 * Each one computes the string referenced by its return value from the
 * strings referenced by its parameters.
 */
public enum StringFunction {
	/** char *strcpy(char *dest, const char *src) */
	STRCPY(2, true, "strcpy", "__strcpy_chk") {
		@Override
		<T extends StringDomain<T>> T apply(List<T> args, T empty) {
			return args.get(1);
		}
	},
	/** char *stpcpy(char *dest, const char *src), returns the end of dest */
	STPCPY(2, true, "stpcpy", "__stpcpy_chk") {
		@Override
		<T extends StringDomain<T>> T apply(List<T> args, T empty) {
			return empty;
		}
	},
	/** char *strncpy(char *dest, const char *src, size_t n) */
	STRNCPY(2, true, "strncpy", "__strncpy_chk") {
		@Override
		<T extends StringDomain<T>> T apply(List<T> args, T empty) {
			return truncated(args.get(1), empty);
		}
	},
	/** char *strcat(char *dest, const char *src) */
	STRCAT(2, true, "strcat", "__strcat_chk") {
		@Override
		<T extends StringDomain<T>> T apply(List<T> args, T empty) {
			return args.get(0).insertStringDomain(args.get(1));
		}
	},
	/** char *strncat(char *dest, const char *src, size_t n) */
	STRNCAT(2, true, "strncat", "__strncat_chk") {
		@Override
		<T extends StringDomain<T>> T apply(List<T> args, T empty) {
			return args.get(0).insertStringDomain(truncated(args.get(1), empty));
		}
	},
	/** char *strdup(const char *s) */
	STRDUP(1, false, "strdup") {
		@Override
		<T extends StringDomain<T>> T apply(List<T> args, T empty) {
			return args.get(0);
		}
	},
	/** char *strndup(const char *s, size_t n) */
	STRNDUP(1, false, "strndup") {
		@Override
		<T extends StringDomain<T>> T apply(List<T> args, T empty) {
			return truncated(args.get(0), empty);
		}
	};

	private static final ImmutableMap<String, StringFunction> BY_NAME;

	static {
		var map = ImmutableMap.<String, StringFunction>builder();
		for (var fn : values()) {
			for (var name : fn.names) {
				map.put(name, fn);
			}
		}
		BY_NAME = map.build();
	}

	private final int arity;
	private final boolean writesDestination;
	private final ImmutableList<String> names;

	StringFunction(int arity, boolean writesDestination, String... names) {
		this.arity = arity;
		this.writesDestination = writesDestination;
		this.names = ImmutableList.copyOf(names);
	}

	/**
	 * @return The modeled function with the given symbol name, if any.
	 */
	public static Optional<StringFunction> forName(String name) {
		return Optional.ofNullable(BY_NAME.get(name));
	}

	/**
	 * @return The number of string parameters read.
	 */
	public int getArity() {
		return this.arity;
	}

	/**
	 * @return Whether the function writes into the buffer its first
	 *         parameter points to.
	 */
	public boolean writesDestination() {
		return this.writesDestination;
	}

	/**
	 * @return The symbol names this model applies to.
	 */
	public ImmutableList<String> getNames() {
		return this.names;
	}

	/**
	 * A prefix of the given string, of unknown length.
	 */
	static <T extends StringDomain<T>> T truncated(T string, T empty) {
		return string.merge(empty);
	}

	/**
	 * Compute the string referenced by the return value.
	 *
	 * @param args
	 *            The strings referenced by the first {@link #getArity()}
	 *            parameters, top where unknown.
	 * @param empty
	 *            The abstract value of the empty string.
	 */
	public <T extends StringDomain<T>> T evaluate(List<T> args, T empty) {
		Preconditions.checkArgument(args.size() >= this.arity,
			"%s needs %s arguments, got %s", this, this.arity, args.size());
		return apply(args, empty);
	}

	abstract <T extends StringDomain<T>> T apply(List<T> args, T empty);
}
