package absstr.memory;

import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.Objects;

/**
 * A contiguous region of the memory image.
 */
public final class MemorySegment {
	private final long base;
	private final byte[] bytes;
	private final boolean writeable;
	private final boolean executable;

	public MemorySegment(long base, byte[] bytes, boolean writeable, boolean executable) {
		Preconditions.checkArgument(base + bytes.length >= base, "Segment at %s wraps around", base);
		this.base = base;
		this.bytes = bytes.clone();
		this.writeable = writeable;
		this.executable = executable;
	}

	/**
	 * @return A read-only, non-executable data segment.
	 */
	public static MemorySegment readOnly(long base, byte[] bytes) {
		return new MemorySegment(base, bytes, false, false);
	}

	public long getBase() {
		return this.base;
	}

	/**
	 * @return The size in bytes.
	 */
	public int getSize() {
		return this.bytes.length;
	}

	public boolean isWriteable() {
		return this.writeable;
	}

	public boolean isExecutable() {
		return this.executable;
	}

	/**
	 * @return Whether the address lies within this segment.
	 */
	public boolean contains(long address) {
		return address >= this.base && address - this.base < this.bytes.length;
	}

	/**
	 * @return Whether [address, address + size) lies within this segment.
	 */
	public boolean contains(long address, int size) {
		return contains(address) && address - this.base + size <= this.bytes.length;
	}

	/**
	 * @return A copy of the bytes at [address, address + size).
	 */
	public byte[] read(long address, int size) {
		Preconditions.checkArgument(contains(address, size),
			"[%s, +%s) is outside of segment %s", address, size, this);
		int start = (int) (address - this.base);
		return Arrays.copyOfRange(this.bytes, start, start + size);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof MemorySegment)) {
			return false;
		}

		var other = (MemorySegment) obj;
		return this.base == other.base
			&& Arrays.equals(this.bytes, other.bytes)
			&& this.writeable == other.writeable
			&& this.executable == other.executable;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.base, Arrays.hashCode(this.bytes), this.writeable, this.executable);
	}

	@Override
	public String toString() {
		return String.format("[%#x, %#x) %s%s", this.base, this.base + this.bytes.length,
			this.writeable ? "w" : "-", this.executable ? "x" : "-");
	}
}
