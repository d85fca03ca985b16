package absstr.memory;

import absstr.StringsConfig;
import absstr.util.Log;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Read access to the global memory of a binary as it is loaded at runtime.
 *
 * Only values of read-only segments are meaningful to the analysis, since
 * writeable global memory may change during execution.
 */
public interface RuntimeMemoryImage {
	/**
	 * @return The bytes at [address, address + size), if all are mapped.
	 */
	Optional<byte[]> read(long address, int size);

	/**
	 * @return Whether the address is mapped by the image.
	 */
	boolean isGlobalMemoryAddress(long address);

	/**
	 * @return Whether the address is mapped and writeable.
	 */
	boolean isAddressWriteable(long address);

	/**
	 * @return Whether multi-byte values are stored big-endian.
	 */
	boolean isBigEndian();

	/**
	 * Read an unsigned integer, such as a pointer, of the given byte size.
	 *
	 * @return The value, if the bytes are mapped.
	 */
	default OptionalLong readPointer(long address, int size) {
		var bytes = read(address, size).orElse(null);
		if (bytes == null || size > Long.BYTES) {
			return OptionalLong.empty();
		}

		long value = 0;
		for (int i = 0; i < size; ++i) {
			int index = isBigEndian() ? i : size - 1 - i;
			value = (value << 8) | (bytes[index] & 0xFF);
		}
		return OptionalLong.of(value);
	}

	/**
	 * Read a NUL-terminated string.  Each byte becomes one character.
	 *
	 * @return The string, if it is mapped and terminated within
	 *         {@link StringsConfig#MAX_STRING_LENGTH} bytes.
	 */
	default Optional<String> readStringUntilNullTerminator(long address) {
		for (int length = 0; length < StringsConfig.MAX_STRING_LENGTH; ++length) {
			var bytes = read(address + length, 1).orElse(null);
			if (bytes == null) {
				Log.trace("Unterminated string at %#x", address);
				return Optional.empty();
			}
			if (bytes[0] == 0) {
				return read(address, length)
					.map(str -> new String(str, StandardCharsets.ISO_8859_1));
			}
		}

		Log.trace("String at %#x exceeds %d bytes", address, StringsConfig.MAX_STRING_LENGTH);
		return Optional.empty();
	}
}
